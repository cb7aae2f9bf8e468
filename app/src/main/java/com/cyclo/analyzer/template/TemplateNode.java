package com.cyclo.analyzer.template;

/**
 * A node of a parsed template. Nodes are immutable and keep the 1-based source
 * line they start on.
 */
public interface TemplateNode {

    int line();

    /**
     * Short one-line representation used in diagnostic dumps.
     */
    String describe();

    <R, X extends Exception> R accept(TemplateNodeVisitor<R, X> visitor) throws X;
}
