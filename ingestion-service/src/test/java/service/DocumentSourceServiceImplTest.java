package service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.lite.ingestion.config.IngestionProperties;
import org.lite.ingestion.entity.QueueEntry;
import org.lite.ingestion.enums.DocumentType;
import org.lite.ingestion.exception.SourceNotFoundException;
import org.lite.ingestion.service.DocumentTypeDetector;
import org.lite.ingestion.service.impl.DocumentSourceServiceImpl;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DocumentSourceServiceImplTest {

    @TempDir
    Path downloadDir;

    @Mock
    private DocumentTypeDetector documentTypeDetector;

    private DocumentSourceServiceImpl sourceService;

    @BeforeEach
    void setUp() {
        IngestionProperties properties = new IngestionProperties();
        properties.getPipeline().setDownloadDir(downloadDir.toString());
        sourceService = new DocumentSourceServiceImpl(WebClient.builder(), documentTypeDetector, properties);
    }

    @Test
    void testResolve_DeclaredLocalFile() throws IOException {
        // Given
        Path file = Files.write(downloadDir.resolve("elsewhere.pdf"), bytes("declared"));
        stubDetector();
        QueueEntry entry = entry("C1_sow.pdf").toBuilder().localFilePath(file.toString()).build();

        // When / Then
        StepVerifier.create(sourceService.resolve(entry))
                .assertNext(source -> {
                    assertEquals("declared", new String(source.getContent(), StandardCharsets.UTF_8));
                    assertEquals(file.toString(), source.getOrigin());
                    assertEquals(DocumentType.PDF, source.getType());
                })
                .verifyComplete();
    }

    @Test
    void testResolve_ExactFilenameInDownloadDirectory() throws IOException {
        // Given
        Files.write(downloadDir.resolve("C1_sow.pdf"), bytes("exact"));
        Files.write(downloadDir.resolve("C1_other.pdf"), bytes("other"));
        stubDetector();
        QueueEntry entry = entry("C1_sow.pdf").toBuilder().localFilePath(downloadDir.resolve("gone.pdf").toString()).build();

        // When / Then
        StepVerifier.create(sourceService.resolve(entry))
                .assertNext(source -> assertEquals("exact", new String(source.getContent(), StandardCharsets.UTF_8)))
                .verifyComplete();
    }

    @Test
    void testResolve_FileMatchingContractId() throws IOException {
        // Given
        Files.write(downloadDir.resolve("notes_C1.txt"), bytes("ignored"));
        Files.write(downloadDir.resolve("attachment_C1_b.docx"), bytes("second"));
        Files.write(downloadDir.resolve("attachment_C1_a.pdf"), bytes("first"));
        stubDetector();

        // When / Then
        StepVerifier.create(sourceService.resolve(entry("C1_missing.pdf")))
                .assertNext(source -> assertEquals("first", new String(source.getContent(), StandardCharsets.UTF_8)))
                .verifyComplete();
    }

    @Test
    void testResolve_NoLocalFileAndNoUrl() {
        StepVerifier.create(sourceService.resolve(entry("C2_missing.pdf").toBuilder().contractNoticeId("C2").build()))
                .expectError(SourceNotFoundException.class)
                .verify();
        verifyNoInteractions(documentTypeDetector);
    }

    private void stubDetector() {
        when(documentTypeDetector.detect(any(), any(), anyString())).thenReturn(DocumentType.PDF);
        when(documentTypeDetector.correctFilename(anyString(), eq(DocumentType.PDF)))
                .thenAnswer(invocation -> invocation.getArgument(0));
    }

    private QueueEntry entry(String filename) {
        return QueueEntry.builder()
                .id("entry-1")
                .contractNoticeId("C1")
                .filename(filename)
                .build();
    }

    private byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }
}
