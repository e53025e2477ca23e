package com.github.rewrite.solidity.diagnostics;

import com.github.rewrite.solidity.namespace.Variable;
import com.github.rewrite.solidity.tree.TextRange;
import lombok.Value;

import java.util.List;

/**
 * The state variables of one contract that can be moved into namespaced storage.
 */
@Value
public class ContractCandidates {
    String contractName;
    TextRange contractRange;
    List<Variable> variables;
}
