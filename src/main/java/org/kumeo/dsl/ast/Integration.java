package org.kumeo.dsl.ast;

import org.kumeo.dsl.tree.SourceSpan;

/**
 * Binding of a subworkflow into a workflow.
 *
 * @param workflowSpan    span of the workflow reference
 * @param subworkflowSpan span of the subworkflow reference
 * @param span            span of the {@code integration} keyword
 */
public record Integration(
 String workflow,
 String subworkflow,
 Mapping mapping,
 SourceSpan workflowSpan,
 SourceSpan subworkflowSpan,
 SourceSpan span) {}
