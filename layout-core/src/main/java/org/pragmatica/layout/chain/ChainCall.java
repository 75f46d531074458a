package org.pragmatica.layout.chain;

import org.pragmatica.layout.fragment.Fragment;

import java.util.function.UnaryOperator;

/**
 * One property access or method call in a chain, along with any postfix operations applied to it.
 */
public record ChainCall(Fragment fragment, CallKind kind) {
    public static ChainCall chainCall(Fragment fragment, CallKind kind) {
        return new ChainCall(fragment, kind);
    }

    public boolean canSplit() {
        return kind.canSplit();
    }

    public boolean isProperty() {
        return kind == CallKind.PROPERTY;
    }

    /**
     * This call with a postfix operation applied.
     *
     * @param postfix builds a fragment containing the given call fragment followed by the postfix operator
     */
    public ChainCall wrapPostfix(UnaryOperator<Fragment> postfix) {
        return new ChainCall(postfix.apply(fragment), kind);
    }
}
