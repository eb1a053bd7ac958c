package com.esfront.ast;

/** Property key in object literals and patterns. */
public sealed interface PropName extends Node permits
    Ident,
    Str,
    Num,
    ComputedPropName {
}
