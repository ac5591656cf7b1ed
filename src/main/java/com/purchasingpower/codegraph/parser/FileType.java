package com.purchasingpower.codegraph.parser;

import org.treesitter.TSLanguage;
import org.treesitter.TreeSitterBash;
import org.treesitter.TreeSitterC;
import org.treesitter.TreeSitterCSharp;
import org.treesitter.TreeSitterCpp;
import org.treesitter.TreeSitterGo;
import org.treesitter.TreeSitterJava;
import org.treesitter.TreeSitterJavascript;
import org.treesitter.TreeSitterPhp;
import org.treesitter.TreeSitterPython;
import org.treesitter.TreeSitterRuby;
import org.treesitter.TreeSitterRust;
import org.treesitter.TreeSitterTypescript;

import java.util.List;
import java.util.function.Supplier;

/**
 * File categories the graph builder distinguishes.
 *
 * <p>Source languages carry a grammar supplier; {@link #TEXT} goes to the document chunker and
 * {@link #UNSUPPORTED} contributes only its FileNode.
 */
public enum FileType {
    BASH(List.of(".sh", ".bash"), TreeSitterBash::new),
    C(List.of(".c"), TreeSitterC::new),
    CSHARP(List.of(".cs"), TreeSitterCSharp::new),
    CPP(List.of(".cpp", ".cc", ".cxx"), TreeSitterCpp::new),
    GO(List.of(".go"), TreeSitterGo::new),
    JAVA(List.of(".java"), TreeSitterJava::new),
    JAVASCRIPT(List.of(".js"), TreeSitterJavascript::new),
    PHP(List.of(".php"), TreeSitterPhp::new),
    PYTHON(List.of(".py"), TreeSitterPython::new),
    RUBY(List.of(".rb"), TreeSitterRuby::new),
    RUST(List.of(".rs"), TreeSitterRust::new),
    TYPESCRIPT(List.of(".ts"), TreeSitterTypescript::new),
    TEXT(List.of(".md", ".markdown", ".txt", ".rst"), null),
    UNSUPPORTED(List.of(), null);

    private final List<String> extensions;
    private final Supplier<TSLanguage> grammar;

    FileType(List<String> extensions, Supplier<TSLanguage> grammar) {
        this.extensions = extensions;
        this.grammar = grammar;
    }

    public List<String> getExtensions() {
        return extensions;
    }

    public boolean hasGrammar() {
        return grammar != null;
    }

    /**
     * Creates a fresh grammar instance. Only valid when {@link #hasGrammar()} is true.
     */
    public TSLanguage newLanguage() {
        if (grammar == null) {
            throw new IllegalStateException(name() + " has no tree-sitter grammar");
        }
        return grammar.get();
    }
}
