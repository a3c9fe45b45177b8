package com.questrail.yamlite.io;

/**
 * Failure categories of document operations. There is no syntax error kind:
 * decoding is lenient and always produces a tree.
 */
public enum YamlErrorKind {
    /** Open, read or write failure; the message carries the underlying reason. */
    IO,

    /** A modify operation's mutator declined to produce a result. */
    MUTATOR
}
