package com.esfront;

import java.util.List;

/**
 * One flavour of the {@code { ... }} production. The brace and comma handling
 * is shared in {@link Parser#parseObject(ParseObject)}; a strategy supplies the
 * per-property grammar and builds the resulting node.
 *
 * @param <T> the object node
 * @param <P> the property node
 */
public interface ParseObject<T, P> {

    /** Parses one property; the current token is its first token. */
    P parseObjectProp(Parser parser);

    T makeObject(Span span, List<P> props);
}
