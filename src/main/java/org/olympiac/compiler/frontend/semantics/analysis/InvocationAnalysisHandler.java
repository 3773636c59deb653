package org.olympiac.compiler.frontend.semantics.analysis;

import org.olympiac.compiler.frontend.parser.ast.AstNode;
import org.olympiac.compiler.frontend.semantics.BuiltinSignature;
import org.olympiac.compiler.frontend.semantics.Decoration;
import org.olympiac.compiler.frontend.semantics.TypeTag;
import org.olympiac.compiler.frontend.semantics.VerificationContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Handles invocations ({@code narrar}, {@code input}, {@code Comparar} and any other name).
 * Built-ins are checked against their {@link BuiltinSignature}; other names only get their
 * arguments resolved. Every bare identifier among the arguments of {@code narrar} and of
 * unknown invocations must be declared.
 */
public class InvocationAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, VerificationContext context) {
        String name = node.content();
        List<String> args = node.stringListAttribute("args");
        List<TypeTag> argTypes = new ArrayList<>(args.size());
        for (String arg : args) {
            argTypes.add(context.resolveArgType(arg));
        }

        Optional<BuiltinSignature> builtin = BuiltinSignature.find(name);
        TypeTag result = TypeTag.UNKNOWN;
        if (builtin.isPresent()) {
            BuiltinSignature signature = builtin.get();
            result = signature.returnType();
            if (signature.arity() != null && args.size() != signature.arity()) {
                context.reportError("call to '" + name + "' with wrong arity: expected " + signature.arity()
                        + ", found " + args.size(), node);
            }
            if (signature.entityArguments()) {
                for (int i = 0; i < argTypes.size(); i++) {
                    if (!argTypes.get(i).isEntity()) {
                        context.reportError("argument " + (i + 1) + " of " + name + " must be an entity; found '"
                                + argTypes.get(i) + "'", node);
                    }
                }
            } else if (signature.arity() == null) {
                checkDeclared(node, args, argTypes, context);
            }
        } else {
            checkDeclared(node, args, argTypes, context);
        }

        List<String> renderedTypes = new ArrayList<>(argTypes.size());
        argTypes.forEach(type -> renderedTypes.add(type.toString()));
        context.decorate(node, Decoration.builder(result)
                .with("name", name)
                .with("args", List.copyOf(args))
                .with("argTypes", renderedTypes)
                .build());
        context.visitChildren(node);
    }

    private static void checkDeclared(AstNode node, List<String> args, List<TypeTag> argTypes,
                                      VerificationContext context) {
        if (context.insideSyntaxError()) {
            return;
        }
        for (int i = 0; i < args.size(); i++) {
            if (argTypes.get(i).isUnknown() && VerificationContext.isBareIdentifier(args.get(i))) {
                context.reportError("identifier '" + args.get(i).strip() + "' used before being declared", node);
            }
        }
    }
}
