package com.esfront.ast;

public sealed interface Stmt extends Node permits
    BlockStmt,
    EmptyStmt,
    ExprStmt,
    ReturnStmt,
    IfStmt,
    ThrowStmt,
    VarDecl,
    FnDecl {
}
