package org.argus.input;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.argus.address.AddressNormalizer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DocumentTextReaderTest {
    @TempDir
    Path tempDir;

    @Test
    void readsPlainTextFiles() throws Exception {
        final var file = Files.writeString(tempDir.resolve("access.log"),
                "GET / from 8.8.8.8\nGET /admin from 192.168.1.10\nGET / from 1.1.1.1\n");

        final var text = DocumentTextReader.read(file);

        assertThat(AddressNormalizer.extract(text)).containsExactly("1.1.1.1", "8.8.8.8");
    }

    @Test
    void readsEveryCellOfEverySpreadsheet() throws Exception {
        final var file = tempDir.resolve("hosts.xlsx");
        try (var workbook = new XSSFWorkbook(); var out = Files.newOutputStream(file)) {
            final var first = workbook.createSheet("edge");
            first.createRow(0).createCell(0).setCellValue("8.8.8.8");
            first.createRow(2).createCell(3).setCellValue("seen 9.9.9.9 twice");
            workbook.createSheet("core").createRow(0).createCell(1).setCellValue("1.1.1.1");
            workbook.write(out);
        }

        final var text = DocumentTextReader.read(file);

        assertThat(AddressNormalizer.extract(text)).containsExactly("1.1.1.1", "8.8.8.8", "9.9.9.9");
    }

    @Test
    void readsPdfText() throws Exception {
        final var file = tempDir.resolve("report.pdf");
        try (var document = new PDDocument()) {
            final var page = new PDPage();
            document.addPage(page);
            try (var content = new PDPageContentStream(document, page)) {
                content.beginText();
                content.setFont(PDType1Font.HELVETICA, 12);
                content.newLineAtOffset(72, 700);
                content.showText("Suspicious source 203.0.114.9 and 8.8.4.4");
                content.endText();
            }
            document.save(file.toFile());
        }

        final var text = DocumentTextReader.read(file);

        assertThat(AddressNormalizer.extract(text)).containsExactly("8.8.4.4", "203.0.114.9");
    }

    @Test
    void missingFileIsReportedAsSuch() {
        assertThatThrownBy(() -> DocumentTextReader.read(tempDir.resolve("nope.txt")))
                .isInstanceOf(NoSuchFileException.class);
    }
}
