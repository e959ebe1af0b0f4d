package org.l5xst.convert;

import java.util.List;
import java.util.Optional;

import org.l5xst.Diagnostic;
import org.l5xst.fidelity.FidelityReport;
import org.l5xst.ir.IR;

/**
 * Outcome of one conversion: the produced text (ST source or L5X document), the IR it was
 * written from, the recoverable problems met on the way and, in validation mode, the fidelity report.
 */
public record ConversionResult(
    String text,
    IR.Program ir,
    List<Diagnostic> diagnostics,
    Optional<FidelityReport> fidelity
) {
    public ConversionResult {
        diagnostics = List.copyOf(diagnostics);
    }

    public ConversionResult withFidelity(FidelityReport report) {
        return new ConversionResult(text, ir, diagnostics, Optional.of(report));
    }
}
