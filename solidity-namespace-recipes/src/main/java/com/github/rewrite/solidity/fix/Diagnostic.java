package com.github.rewrite.solidity.fix;

import com.github.rewrite.solidity.text.Range;
import lombok.Value;

/**
 * A problem reported on a range of a document, which a {@link CodeFix} may address.
 */
@Value
public class Diagnostic {
    Range range;
    DiagnosticSeverity severity;
    String code;
    String message;
    String source;
}
