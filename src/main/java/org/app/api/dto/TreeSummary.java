package org.app.api.dto;

/**
 * Shape of the trained tree.
 *
 * @param rootAttribute attribute tested at the root
 * @param depth         node levels on the longest path
 * @param leaves        number of leaf verdicts
 */
public record TreeSummary(String rootAttribute, int depth, int leaves) {
}
