package com.esfront.ast;

/** Property of an object pattern. */
public sealed interface ObjectPatProp extends Node permits
    KeyValuePatProp,
    AssignPatProp,
    RestPat {
}
