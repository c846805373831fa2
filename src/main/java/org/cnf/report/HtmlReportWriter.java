package org.cnf.report;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Logger;

/**
 * Report HTML della validazione di file DIMACS: una riga per file con esito,
 * clausole valide e non valide, tempo e variazione di memoria.
 */
public class HtmlReportWriter {

    private static final Logger LOGGER = Logger.getLogger(HtmlReportWriter.class.getName());

    private final String title;

    public HtmlReportWriter() {
        this("Validazione file CNF");
    }

    public HtmlReportWriter(String title) {
        this.title = title;
    }

    /**
     * Scrive il report nel file indicato, creando le directory mancanti.
     *
     * @throws IOException se il file non può essere scritto
     */
    public void write(List<FileValidationResult> results, Path output) throws IOException {
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        try (Writer writer = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
            writer.write(render(results));
        }
        LOGGER.info("Report HTML salvato: " + output);
    }

    public String render(List<FileValidationResult> results) {
        StringBuilder html = new StringBuilder();
        html.append("<!DOCTYPE html>\n<html>\n<head>\n<meta charset=\"UTF-8\">\n")
                .append("<title>").append(escape(title)).append("</title>\n")
                .append("<style>table{border-collapse:collapse}td,th{border:1px solid #999;padding:4px 8px}")
                .append(".valid{color:#070}.invalid{color:#a00}.error{color:#a60}</style>\n")
                .append("</head>\n<body>\n<h1>").append(escape(title)).append("</h1>\n")
                .append("<table>\n<tr><th>File</th><th>Esito</th><th>Clausole valide</th>")
                .append("<th>Clausole non valide</th><th>Tempo (ms)</th><th>Memoria (KB)</th></tr>\n");

        int validFiles = 0;
        for (FileValidationResult result : results) {
            html.append("<tr><td>").append(escape(result.fileName())).append("</td>");

            if (result.isFailed()) {
                html.append("<td class=\"error\">Errore: ").append(escape(result.error())).append("</td>")
                        .append("<td>-</td><td>-</td>");
            } else {
                if (result.valid()) {
                    validFiles++;
                }
                html.append("<td class=\"").append(result.valid() ? "valid\">Valida" : "invalid\">Non valida")
                        .append("</td><td>").append(result.validClauses())
                        .append("</td><td>").append(result.invalidClauses()).append("</td>");
            }

            html.append("<td>").append(result.elapsedMillis())
                    .append("</td><td>").append(result.memoryDeltaBytes() / 1024).append("</td></tr>\n");
        }

        html.append("</table>\n<p>File validi: ").append(validFiles).append(" su ").append(results.size())
                .append("</p>\n</body>\n</html>\n");
        return html.toString();
    }

    static String escape(String text) {
        if (text == null) {
            return "";
        }
        StringBuilder escaped = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            switch (c) {
                case '<' -> escaped.append("&lt;");
                case '>' -> escaped.append("&gt;");
                case '&' -> escaped.append("&amp;");
                case '"' -> escaped.append("&quot;");
                case '\'' -> escaped.append("&#39;");
                default -> escaped.append(c);
            }
        }
        return escaped.toString();
    }
}
