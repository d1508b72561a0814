package ai.widgetprops.analyzer.ast;

/** The body of a function: either a block or an {@code => expression;} body. */
public abstract class FunctionBody extends AstNode {}
