package com.zwave.generator.codegen.model.input;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * An attribute-bearing element of the source document with its direct children.
 *
 * Pure structure only: no parsing, no validation.
 */
@Value
@Builder(toBuilder = true)
public class MarkupNode {

    @NonNull
    String elementName;

    @Singular
    Map<String, String> attributes;

    @Singular("child")
    List<MarkupNode> children;

    public Optional<String> getAttribute(String name) {
        return Optional.ofNullable(attributes.get(name));
    }

    /** Direct children with the given element name, in document order. */
    public List<MarkupNode> getChildren(String name) {
        List<MarkupNode> result = new ArrayList<>();
        for (MarkupNode child : children) {
            if (child.getElementName().equals(name)) {
                result.add(child);
            }
        }
        return result;
    }
}
