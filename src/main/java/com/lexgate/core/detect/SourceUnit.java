package com.lexgate.core.detect;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Position;
import com.github.javaparser.Problem;
import com.github.javaparser.Range;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.Node;
import com.lexgate.core.model.ContentHash;
import com.lexgate.core.model.Span;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * One source file as the detectors see it: its exact text plus, when it parses, its
 * JavaParser syntax tree. Offsets and spans computed here are consistent with the text.
 */
public final class SourceUnit {

    private final String path;
    private final String text;
    private final CompilationUnit compilationUnit;
    private final String parseProblem;
    private final Span problemSpan;
    private final int[] lineStarts;
    private String sha256;

    private SourceUnit(String path, String text, CompilationUnit compilationUnit,
                       String parseProblem, Span problemSpan) {
        this.path = path;
        this.text = text;
        this.compilationUnit = compilationUnit;
        this.parseProblem = parseProblem;
        this.problemSpan = problemSpan;
        this.lineStarts = lineStarts(text);
    }

    /**
     * Parses {@code text}. Never throws for malformed input; check {@link #parses()}.
     */
    public static SourceUnit parse(String path, String text) {
        // JavaParser instances are not thread-safe
        var parser = new JavaParser(new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));
        ParseResult<CompilationUnit> result = parser.parse(text);
        if (result.isSuccessful() && result.getResult().isPresent()) {
            return new SourceUnit(path, text, result.getResult().get(), null, null);
        }
        List<Problem> problems = result.getProblems();
        if (problems.isEmpty()) {
            return new SourceUnit(path, text, null, "unknown parse error", Span.line(1));
        }
        Problem first = problems.get(0);
        Span at = first.getLocation()
                .flatMap(tokens -> tokens.getBegin().getRange())
                .map(r -> new Span(Math.max(1, r.begin.line), Math.max(1, r.begin.column),
                        Math.max(1, r.begin.line), Math.max(1, r.begin.column)))
                .orElse(Span.line(1));
        return new SourceUnit(path, text, null, first.getMessage().lines().findFirst().orElse("parse error"), at);
    }

    public String path() {
        return path;
    }

    public String text() {
        return text;
    }

    public boolean parses() {
        return compilationUnit != null;
    }

    public Optional<CompilationUnit> compilationUnit() {
        return Optional.ofNullable(compilationUnit);
    }

    public CompilationUnit requireCompilationUnit() {
        if (compilationUnit == null) {
            throw new IllegalStateException(path + " does not parse: " + parseProblem);
        }
        return compilationUnit;
    }

    public String parseProblem() {
        return parseProblem;
    }

    public Span problemSpan() {
        return problemSpan;
    }

    public String sha256() {
        if (sha256 == null) {
            sha256 = ContentHash.sha256(text);
        }
        return sha256;
    }

    public int lineCount() {
        return lineStarts.length;
    }

    /** Text of a 1-based line, without its terminator. */
    public String line(int line) {
        int start = lineStarts[line - 1];
        int end = line < lineStarts.length ? lineStarts[line] - 1 : text.length();
        if (end > start && text.charAt(end - 1) == '\r') {
            end--;
        }
        return text.substring(start, end);
    }

    public String indentOf(int line) {
        String content = line(line);
        int i = 0;
        while (i < content.length() && (content.charAt(i) == ' ' || content.charAt(i) == '\t')) {
            i++;
        }
        return content.substring(0, i);
    }

    public String lineSeparator() {
        return text.contains("\r\n") ? "\r\n" : "\n";
    }

    public int offset(Position position) {
        return lineStarts[position.line - 1] + position.column - 1;
    }

    public Span span(Node node) {
        Range r = range(node);
        return new Span(r.begin.line, r.begin.column, r.end.line, r.end.column);
    }

    /** Edit replacing exactly the characters of {@code node}. */
    public TextEdit replace(Node node, String replacement) {
        Range r = range(node);
        return new TextEdit(offset(r.begin), offset(r.end) + 1, replacement);
    }

    /** Edit inserting {@code text} right after the last character of {@code node}. */
    public TextEdit insertAfter(Node node, String insertion) {
        return TextEdit.insert(offset(range(node).end) + 1, insertion);
    }

    /**
     * How to spell a fully qualified type in this file: its simple name when it is in
     * {@code java.lang}, in the same package, or imported; otherwise the qualified name.
     */
    public String typeReference(String qualifiedName) {
        int dot = qualifiedName.lastIndexOf('.');
        if (dot < 0) {
            return qualifiedName;
        }
        String pkg = qualifiedName.substring(0, dot);
        String simple = qualifiedName.substring(dot + 1);
        if ("java.lang".equals(pkg) || compilationUnit == null) {
            return "java.lang".equals(pkg) ? simple : qualifiedName;
        }
        boolean samePackage = compilationUnit.getPackageDeclaration()
                .map(p -> p.getNameAsString().equals(pkg))
                .orElse(false);
        if (samePackage) {
            return simple;
        }
        for (ImportDeclaration imp : compilationUnit.getImports()) {
            if (imp.isStatic()) {
                continue;
            }
            if (imp.isAsterisk() ? imp.getNameAsString().equals(pkg) : imp.getNameAsString().equals(qualifiedName)) {
                return simple;
            }
        }
        return qualifiedName;
    }

    private Range range(Node node) {
        return node.getRange()
                .orElseThrow(() -> new IllegalStateException("Node without source range in " + path));
    }

    private static int[] lineStarts(String text) {
        var starts = new ArrayList<Integer>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        return starts.stream().mapToInt(Integer::intValue).toArray();
    }
}
