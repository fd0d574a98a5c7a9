// file: format/src/main/java/io/sumspec/format/Format.java
package io.sumspec.format;

import java.util.List;

/**
 * An output representation for expressions: one method per expression
 * variant.
 * <p>
 * Responsibilities:
 *  - Turn already-rendered child fragments into this node's fragment.
 *  - Choose the grouping syntax; <em>whether</em> to group is decided by
 *    {@link Fragment.Slot}.
 * <p>
 * Design:
 *  - Implementations never see the expression tree, only fragments and, for
 *    binders, {@link Binder} descriptors. Traversal lives in {@link Renderer}.
 *  - Every method is abstract, so a concrete format that compiles handles
 *    every variant. Third-party formats that want to support a subset extend
 *    {@link FormatAdapter} instead.
 *  - Implementations are stateless or hold immutable configuration only.
 */
public interface Format {

    /** Name used in diagnostics. */
    default String name() {
        return getClass().getSimpleName();
    }

    Fragment constant(String value);

    Fragment variable(String name);

    Fragment challenge(int stage, String label);

    /** A point; an empty component list denotes a polynomial without variables. */
    Fragment opening(List<Fragment> components);

    Fragment committed(String name, Fragment point);

    Fragment virtual(String name, Fragment point);

    Fragment verifier(String name, Fragment point);

    /** {@code left + right}; a negated {@code right} should render as subtraction. */
    Fragment add(Fragment left, Fragment right);

    Fragment mul(Fragment left, Fragment right);

    Fragment neg(Fragment operand);

    Fragment pow(Fragment base, int exponent);

    Fragment sum(Binder binder, Fragment body);

    Fragment multiSum(List<Binder> binders, Fragment body);

    Fragment finiteSum(String index, String bound, Fragment body);

    Fragment prod(String index, String bound, Fragment body);
}
