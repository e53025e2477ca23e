package com.github.rewrite.solidity.namespace;

import com.github.rewrite.solidity.text.Range;
import lombok.Value;

/**
 * A state variable selected for migration, captured before any edit is computed.
 */
@Value
public class Variable {
    /** The variable name, e.g. {@code balance}. */
    String name;
    /** The declaration as it will appear inside the storage struct, e.g. {@code uint256 balance;}. */
    String content;
    /** Where the original declaration sits in the document. */
    Range range;
}
