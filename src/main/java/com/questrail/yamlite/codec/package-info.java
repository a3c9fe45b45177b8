/**
 * YAML Codec
 * =============================================================================
 *
 * <p>This package defines the <strong>codec layer</strong>: conversion between
 * document text and the {@link com.questrail.yamlite.model.YamlValue} tree.
 * Both directions cover the same pragmatic subset:</p>
 *
 * <ul>
 *   <li>Scalars: null, booleans, numbers, plain and quoted strings</li>
 *   <li>Block sequences ({@code - item}) and block mappings ({@code key: value})</li>
 *   <li>Block scalars introduced by {@code |} or {@code >}</li>
 *   <li>Comment lines and nesting by indentation</li>
 * </ul>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   String text
 *        → YamlDecoder      (lines, indentation stack, scalar grammar)
 *            → YamlValue
 *                → YamlPaths (optional get / set)
 *                    → YamlEncoder  (sorted keys, quoting, block layout)
 *                        → String text
 * </pre>
 *
 * <h2>Important Boundaries</h2>
 * <ul>
 *   <li>The codec performs no I/O. Files are handled by
 *       {@code com.questrail.yamlite.io.YamlFiles}.</li>
 *   <li>Comments, key order and whitespace styling do not survive a round trip.</li>
 *   <li>The decoder does not interpret escape sequences inside quotes while the
 *       encoder does write them.</li>
 * </ul>
 */
package com.questrail.yamlite.codec;
