package service;

import org.junit.jupiter.api.Test;
import org.lite.ingestion.config.IngestionProperties;
import org.lite.ingestion.dto.StartProcessingRequest;
import org.lite.ingestion.entity.ProcessingJob;
import org.lite.ingestion.model.RunPlan;
import org.lite.ingestion.service.RunPlanFactory;

import static org.junit.jupiter.api.Assertions.*;

class RunPlanFactoryTest {

    private final RunPlanFactory runPlanFactory = new RunPlanFactory(new IngestionProperties());

    @Test
    void testPlan_Defaults() {
        // When
        RunPlan plan = runPlanFactory.plan(new StartProcessingRequest());

        // Then
        assertEquals(50, plan.getLimit());
        assertEquals(5, plan.getBatchSize());
        assertFalse(plan.isTestMode());
        assertFalse(plan.isClearQueue());
        assertTrue(plan.isAutoQueue());
        assertEquals(ProcessingJob.TYPE_PARALLEL, plan.getJobType());
    }

    @Test
    void testPlan_SmallLimitSwitchesToTestMode() {
        RunPlan plan = runPlanFactory.plan(StartProcessingRequest.builder().limit(5).concurrency(8).build());

        assertTrue(plan.isTestMode());
        assertTrue(plan.isClearQueue());
        assertEquals(1, plan.getBatchSize());
        assertEquals(5, plan.getMaxContracts());
        assertEquals(ProcessingJob.TYPE_TEST_MODE, plan.getJobType());
    }

    @Test
    void testPlan_ExplicitTestModeWithLargeLimit() {
        RunPlan plan = runPlanFactory.plan(StartProcessingRequest.builder().limit(40).testMode(true).build());

        assertTrue(plan.isTestMode());
        assertEquals(10, plan.getMaxContracts(), "Test runs look at no more than ten contracts");
        assertEquals(40, plan.getSourceLimit());
    }

    @Test
    void testPlan_ConcurrencyIsCapped() {
        RunPlan plan = runPlanFactory.plan(StartProcessingRequest.builder().limit(200).concurrency(100).build());

        assertEquals(30, plan.getBatchSize());
    }

    @Test
    void testPlan_BlankContractIsIgnoredAndAutoQueueCanBeDisabled() {
        RunPlan plan = runPlanFactory.plan(StartProcessingRequest.builder().contractId("  ").autoQueue(false).limit(20).build());

        assertNull(plan.getContractId());
        assertFalse(plan.isAutoQueue());
    }
}
