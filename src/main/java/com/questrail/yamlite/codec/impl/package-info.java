/**
 * YAML Codec - Default Implementation
 * =============================================================================
 *
 * <p>This package contains the concrete decoder and encoder together with the
 * line, scalar and quoting rules they share.</p>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   String text
 *        → YamlLines.split          (line numbers, indentation, stripped content)
 *        → DefaultYamlDecoder       (indentation stack, lookahead)
 *        → YamlScalars.parse        (null / bool / number / quoted / plain)
 *        → YamlValue
 *
 *   YamlValue
 *        → DefaultYamlEncoder       (sorted keys, block layout)
 *        → YamlQuoting              (quote test, escaping)
 *        → String text
 * </pre>
 *
 * <p>Decoding never fails. Lines that cannot be attached are reported to the
 * observability sink and dropped.</p>
 */
package com.questrail.yamlite.codec.impl;
