package com.esfront.jackson;

import com.esfront.Span;
import com.esfront.Token;
import com.esfront.TokenType;
import com.esfront.ast.*;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.module.SimpleModule;

/**
 * Jackson module that configures serialization for the AST and token classes.
 *
 * This module handles:
 * - the {@code type} property on every node and token
 * - nullable children that are written as {@code null} rather than omitted
 * - JavaScript-compatible number serialization
 */
public class AstModule extends SimpleModule {

    public AstModule() {
        super("AstModule", new Version(0, 1, 0, "SNAPSHOT", "com.esfront", "esfront-jackson"));
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(Node.class, NodeMixin.class);
        context.setMixInAnnotations(Expr.class, NodeMixin.class);
        context.setMixInAnnotations(Pat.class, NodeMixin.class);
        context.setMixInAnnotations(Stmt.class, NodeMixin.class);
        context.setMixInAnnotations(Prop.class, NodeMixin.class);
        context.setMixInAnnotations(PropName.class, NodeMixin.class);
        context.setMixInAnnotations(ObjectPatProp.class, NodeMixin.class);
        context.setMixInAnnotations(Token.class, TokenMixin.class);

        context.setMixInAnnotations(Num.class, NumMixin.class);
        context.setMixInAnnotations(Token.Num.class, TokenNumMixin.class);

        // Nullable children that are part of the node's shape
        context.setMixInAnnotations(FnExpr.class, FnExprMixin.class);
        context.setMixInAnnotations(IfStmt.class, IfStmtMixin.class);
        context.setMixInAnnotations(ReturnStmt.class, ReturnStmtMixin.class);
        context.setMixInAnnotations(VarDeclarator.class, VarDeclaratorMixin.class);
        context.setMixInAnnotations(AssignPatProp.class, AssignPatPropMixin.class);
        context.setMixInAnnotations(YieldExpr.class, YieldExprMixin.class);
    }

    // ==================== Mixins ====================

    @JsonPropertyOrder({"type", "span"})
    private abstract static class NodeMixin {
        @JsonProperty("type")
        abstract String type();

        @JsonProperty("span")
        abstract Span span();
    }

    @JsonPropertyOrder({"type"})
    private abstract static class TokenMixin {
        @JsonProperty("type")
        abstract TokenType type();
    }

    private abstract static class NumMixin extends NodeMixin {
        @JsonSerialize(using = JavaScriptNumberSerializer.class)
        abstract double value();
    }

    private abstract static class TokenNumMixin extends TokenMixin {
        @JsonSerialize(using = JavaScriptNumberSerializer.class)
        abstract double value();
    }

    private abstract static class FnExprMixin extends NodeMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Ident ident();
    }

    private abstract static class IfStmtMixin extends NodeMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Stmt alt();
    }

    private abstract static class ReturnStmtMixin extends NodeMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Expr arg();
    }

    private abstract static class VarDeclaratorMixin extends NodeMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Expr init();
    }

    private abstract static class AssignPatPropMixin extends NodeMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Expr value();
    }

    private abstract static class YieldExprMixin extends NodeMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Expr arg();
    }
}
