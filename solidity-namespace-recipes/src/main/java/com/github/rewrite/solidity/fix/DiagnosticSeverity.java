package com.github.rewrite.solidity.fix;

public enum DiagnosticSeverity {
    ERROR,
    WARNING,
    INFORMATION,
    HINT
}
