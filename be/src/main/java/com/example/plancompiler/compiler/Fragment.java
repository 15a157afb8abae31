package com.example.plancompiler.compiler;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Result of lowering one plan node.
 *
 * @param states   states emitted for the node, in emission order
 * @param entry    name of the state control enters first
 * @param exits    names of the states that leave the node; linking sets their {@code Next}
 * @param assigned flattened names of the variables the node assigns
 */
record Fragment(Map<String, StateRecord> states, String entry, List<String> exits, Set<String> assigned) {
}
