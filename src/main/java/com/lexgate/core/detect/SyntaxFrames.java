package com.lexgate.core.detect;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.InitializerDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;

import java.util.Optional;

/**
 * Names the declaration enclosing a node, e.g. {@code OrderService.load()}.
 */
final class SyntaxFrames {

    private SyntaxFrames() {}

    static String describe(Node node) {
        String member = null;
        Optional<Node> current = Optional.of(node);
        while (current.isPresent()) {
            Node n = current.get();
            if (member == null) {
                if (n instanceof MethodDeclaration m) {
                    member = m.getNameAsString() + "()";
                } else if (n instanceof ConstructorDeclaration c) {
                    member = c.getNameAsString() + "()";
                } else if (n instanceof InitializerDeclaration i) {
                    member = i.isStatic() ? "<clinit>" : "<init>";
                }
            }
            if (n instanceof TypeDeclaration<?> type) {
                return member == null ? type.getNameAsString() : type.getNameAsString() + "." + member;
            }
            current = n.getParentNode();
        }
        return member == null ? "<file>" : member;
    }

    static Optional<MethodDeclaration> enclosingMethod(Node node) {
        Optional<Node> current = node.getParentNode();
        while (current.isPresent()) {
            if (current.get() instanceof MethodDeclaration m) {
                return Optional.of(m);
            }
            current = current.get().getParentNode();
        }
        return Optional.empty();
    }
}
