package service;

import org.junit.jupiter.api.Test;
import org.lite.ingestion.util.DocumentIdentifiers;
import org.lite.ingestion.util.TextUtils;

import static org.junit.jupiter.api.Assertions.*;

class TextUtilsTest {

    @Test
    void testCleanRecognizedText() {
        assertEquals("Item | Qty | Price", TextUtils.cleanRecognizedText("Item  | Qty |   Price ©"));
        assertEquals("Line one line two", TextUtils.cleanRecognizedText("Line one\n\n\tline two"));
        assertEquals("A|B", TextUtils.cleanRecognizedText("A| |B"));
        assertEquals("", TextUtils.cleanRecognizedText(null));
    }

    @Test
    void testWordCount() {
        assertEquals(0, TextUtils.wordCount("   "));
        assertEquals(0, TextUtils.wordCount(null));
        assertEquals(3, TextUtils.wordCount("  scope of\nwork "));
    }

    @Test
    void testStripCodeFences() {
        assertEquals("{\"a\":1}", TextUtils.stripCodeFences("```json\n{\"a\":1}\n```"));
        assertEquals("{\"a\":1}", TextUtils.stripCodeFences("```\n{\"a\":1}\n```"));
        assertEquals("{\"a\":1}", TextUtils.stripCodeFences("{\"a\":1}"));
    }

    @Test
    void testDocumentIdentifier() {
        assertEquals("C1_C1_sow.pdf", DocumentIdentifiers.of("C1", "C1_sow.pdf"));
        assertThrows(IllegalArgumentException.class, () -> DocumentIdentifiers.of(" ", "C1_sow.pdf"));
        assertThrows(IllegalArgumentException.class, () -> DocumentIdentifiers.of("C1", null));
    }

    @Test
    void testFilenameForUrl() {
        assertEquals("C1_sow.pdf", DocumentIdentifiers.filenameFor("C1", "https://sam.gov/api/files/sow.pdf?download=true"));
        assertEquals("C1_download", DocumentIdentifiers.filenameFor("C1", "https://sam.gov/api/files/download/"));
        assertEquals("C1_document", DocumentIdentifiers.filenameFor("C1", ""));
    }
}
