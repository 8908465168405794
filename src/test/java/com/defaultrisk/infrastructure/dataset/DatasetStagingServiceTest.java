package com.defaultrisk.infrastructure.dataset;

import com.defaultrisk.domain.exception.UnsupportedDatasetException;
import com.defaultrisk.domain.model.DatasetRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.mock.web.MockMultipartFile;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class DatasetStagingServiceTest {

    @TempDir
    Path tempDir;

    private DatasetStagingService stagingService;

    @BeforeEach
    void setUp() {
        stagingService = new DatasetStagingService(tempDir.resolve("staging").toString());
    }

    @Test
    void stage_upload_copiesContentUnderGeneratedName() throws IOException {
        MockMultipartFile upload = new MockMultipartFile(
                "file", "ratios.CSV", "text/csv", "stock_symbol,company_name\nAAA,Alpha\n".getBytes(StandardCharsets.UTF_8));

        DatasetRef ref = stagingService.stage(upload);

        Path staged = Path.of(ref.getPath());
        assertEquals("ratios.CSV", ref.getOriginalFilename());
        assertEquals(stagingService.getStagingDirectory(), staged.getParent());
        assertTrue(staged.getFileName().toString().endsWith(".csv"));
        assertEquals("stock_symbol,company_name\nAAA,Alpha\n", Files.readString(staged));
    }

    @Test
    void stage_sameFilenameTwice_keepsBothArtifacts() {
        DatasetRef first = stagingService.stage("ratios.xlsx", new ByteArrayInputStream(new byte[]{1}));
        DatasetRef second = stagingService.stage("ratios.xlsx", new ByteArrayInputStream(new byte[]{2}));

        assertNotEquals(first.getPath(), second.getPath());
        assertTrue(Files.exists(Path.of(first.getPath())));
        assertTrue(Files.exists(Path.of(second.getPath())));
    }

    @Test
    void stage_unsupportedExtension_isRejected() {
        assertThrows(UnsupportedDatasetException.class,
                () -> stagingService.stage("ratios.pdf", new ByteArrayInputStream(new byte[]{1})));
        assertThrows(UnsupportedDatasetException.class,
                () -> stagingService.stage(null, new ByteArrayInputStream(new byte[]{1})));
    }

    @Test
    void stage_emptyUpload_isRejected() {
        MockMultipartFile upload = new MockMultipartFile("file", "ratios.csv", "text/csv", new byte[0]);

        assertThrows(UnsupportedDatasetException.class, () -> stagingService.stage(upload));
    }

    @Test
    void discard_removesArtifactAndToleratesRepeats() {
        DatasetRef ref = stagingService.stage("ratios.csv", new ByteArrayInputStream("a,b\n".getBytes(StandardCharsets.UTF_8)));

        stagingService.discard(ref);
        assertFalse(Files.exists(Path.of(ref.getPath())));

        assertDoesNotThrow(() -> stagingService.discard(ref));
        assertDoesNotThrow(() -> stagingService.discard(null));
    }
}
