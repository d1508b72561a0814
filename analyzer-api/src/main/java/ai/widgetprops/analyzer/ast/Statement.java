package ai.widgetprops.analyzer.ast;

public abstract class Statement extends AstNode {}
