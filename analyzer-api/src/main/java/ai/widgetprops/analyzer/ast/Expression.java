package ai.widgetprops.analyzer.ast;

/** Marker base class for expressions. */
public abstract class Expression extends AstNode {}
