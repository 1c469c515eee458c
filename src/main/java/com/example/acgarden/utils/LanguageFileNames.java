package com.example.acgarden.utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Maps a judge language label to the file name the source is archived under.
 */
public final class LanguageFileNames {

    private static final Logger log = LoggerFactory.getLogger(LanguageFileNames.class);

    public static final String FALLBACK = "Main.txt";

    private static final Map<String, String> FILE_NAMES = new HashMap<>();

    static {
        register("Main.cpp", "C++", "C++14", "C++17", "C++20");
        register("Main.sh", "Bash");
        register("Main.c", "C");
        register("Main.cs", "C#");
        register("Main.clj", "Clojure");
        register("Main.lisp", "Common Lisp");
        register("Main.d", "D");
        register("Main.f08", "Fortran");
        register("Main.go", "Go");
        register("Main.hs", "Haskell");
        register("Main.js", "JavaScript");
        register("Main.java", "Java");
        register("Main.ml", "OCaml");
        register("Main.pas", "Pascal");
        register("Main.pl", "Perl");
        register("Main.php", "PHP");
        register("Main.py", "Python", "Python3", "PyPy2", "PyPy3");
        register("Main.rb", "Ruby");
        register("Main.scala", "Scala");
        register("Main.scm", "Scheme");
        register("Main.vb", "Visual Basic");
        register("Main.m", "Objective-C", "Octave");
        register("Main.swift", "Swift");
        register("Main.rs", "Rust");
        register("Main.sed", "Sed");
        register("Main.awk", "Awk");
        register("Main.bf", "Brainfuck");
        register("Main.sml", "Standard ML");
        register("Main.cr", "Crystal");
        register("Main.fs", "F#");
        register("Main.unl", "Unlambda");
        register("Main.lua", "Lua", "LuaJIT");
        register("Main.moon", "MoonScript");
        register("Main.ceylon", "Ceylon");
        register("Main.jl", "Julia");
        register("Main.nim", "Nim");
        register("Main.ts", "TypeScript");
        register("Main.p6", "Perl6");
        register("Main.kt", "Kotlin");
        register("Main.cob", "COBOL");
    }

    private LanguageFileNames() {}

    private static void register(String fileName, String... languages) {
        for (String language : languages) {
            FILE_NAMES.put(language, fileName);
        }
    }

    /**
     * Strip the compiler/version suffix, e.g. "C++ (GCC 9.2.1)" becomes "C++".
     */
    public static String baseLanguage(String language) {
        if (language == null) {
            return "";
        }
        int paren = language.indexOf('(');
        return (paren >= 0 ? language.substring(0, paren) : language).trim();
    }

    /**
     * Resolve the archive file name for a language label. Unknown languages get
     * {@link #FALLBACK} and a warning; this never fails.
     */
    public static String of(String language) {
        String base = baseLanguage(language);
        String fileName = FILE_NAMES.get(base);
        if (fileName == null) {
            log.warn("Unknown language: {}", base);
            return FALLBACK;
        }
        return fileName;
    }
}
