package org.argus.input;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.WorkbookFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Extracts the text of a document so addresses can be pulled out of it. PDF and Excel files are
 * read through their libraries; anything else is read as UTF-8 text.
 */
public final class DocumentTextReader {
    private DocumentTextReader() {
    }

    public static String read(Path file) throws IOException {
        if (!Files.isRegularFile(file)) throw new NoSuchFileException(file.toString());
        final var name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".pdf")) return readPdf(file);
        if (name.endsWith(".xlsx") || name.endsWith(".xls")) return readExcel(file);
        return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    }

    static String readPdf(Path file) throws IOException {
        try (var document = PDDocument.load(file.toFile())) {
            return new PDFTextStripper().getText(document);
        }
    }

    static String readExcel(Path file) throws IOException {
        final var formatter = new DataFormatter();
        final var text = new StringBuilder();
        try (var workbook = WorkbookFactory.create(file.toFile(), null, true)) {
            for (var sheet : workbook) {
                for (var row : sheet) {
                    for (var cell : row) {
                        final var value = formatter.formatCellValue(cell);
                        if (!value.isEmpty()) text.append(value).append(' ');
                    }
                    text.append('\n');
                }
            }
        }
        return text.toString();
    }
}
