package org.satpath.encoding;

import org.satpath.support.CNFFormula;

import java.io.FileWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Esportazione di una formula nel formato DIMACS standard ("p cnf V C", clausole terminate da 0).
 */
public final class DimacsWriter {

    private DimacsWriter() {
    }

    public static String toDimacs(CNFFormula formula) {
        StringBuilder output = new StringBuilder();
        output.append("p cnf ").append(formula.getVariableCount())
                .append(' ').append(formula.getClausesCount()).append('\n');

        for (List<Integer> clause : formula.getClauses()) {
            for (int literal : clause) {
                output.append(literal).append(' ');
            }
            output.append("0\n");
        }
        return output.toString();
    }

    public static void write(CNFFormula formula, Writer writer) throws IOException {
        writer.write(toDimacs(formula));
        writer.flush();
    }

    /**
     * Scrive la formula su file creando le directory mancanti.
     */
    public static void write(CNFFormula formula, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (FileWriter writer = new FileWriter(file.toFile())) {
            write(formula, writer);
        }
    }
}
