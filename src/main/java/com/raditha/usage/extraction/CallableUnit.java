package com.raditha.usage.extraction;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.Parameter;
import com.raditha.usage.model.DeclarationKind;
import com.raditha.usage.model.DeclarationTrait;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Set;

/**
 * A method, constructor, lambda or initializer block whose parameters and locals are
 * analyzed on their own.
 *
 * @param node            the declaring AST node
 * @param displayName     name used in log messages
 * @param parameterKind   kind given to the parameters
 * @param parameters      declared parameters, empty for initializers
 * @param signatureTraits traits shared by all parameters
 * @param body            the body, or null for abstract and native methods
 */
public record CallableUnit(
        Node node,
        String displayName,
        DeclarationKind parameterKind,
        List<Parameter> parameters,
        Set<DeclarationTrait> signatureTraits,
        @Nullable Node body) {

    public CallableUnit {
        parameters = List.copyOf(parameters);
        signatureTraits = Set.copyOf(signatureTraits);
    }

    public boolean hasBody() {
        return body != null;
    }
}
