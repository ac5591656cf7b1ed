/**
 * File type detection and per-file extraction: tree-sitter syntax trees for source code,
 * header-based chunks for documentation.
 *
 * @since 1.0.0
 */
package com.purchasingpower.codegraph.parser;
