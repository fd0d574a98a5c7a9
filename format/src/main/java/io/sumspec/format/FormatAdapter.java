// file: format/src/main/java/io/sumspec/format/FormatAdapter.java
package io.sumspec.format;

import java.util.List;

/**
 * Base class for partial formats: every method fails with
 * {@link UnsupportedNodeException} until overridden.
 */
public abstract class FormatAdapter implements Format {

    protected final UnsupportedNodeException unsupported(String variant) {
        return new UnsupportedNodeException(variant, name());
    }

    @Override
    public Fragment constant(String value) {
        throw unsupported("Const");
    }

    @Override
    public Fragment variable(String name) {
        throw unsupported("Var");
    }

    @Override
    public Fragment challenge(int stage, String label) {
        throw unsupported("Challenge");
    }

    @Override
    public Fragment opening(List<Fragment> components) {
        throw unsupported("Opening");
    }

    @Override
    public Fragment committed(String name, Fragment point) {
        throw unsupported("CommittedPoly");
    }

    @Override
    public Fragment virtual(String name, Fragment point) {
        throw unsupported("VirtualPoly");
    }

    @Override
    public Fragment verifier(String name, Fragment point) {
        throw unsupported("VerifierPoly");
    }

    @Override
    public Fragment add(Fragment left, Fragment right) {
        throw unsupported("Add");
    }

    @Override
    public Fragment mul(Fragment left, Fragment right) {
        throw unsupported("Mul");
    }

    @Override
    public Fragment neg(Fragment operand) {
        throw unsupported("Neg");
    }

    @Override
    public Fragment pow(Fragment base, int exponent) {
        throw unsupported("Pow");
    }

    @Override
    public Fragment sum(Binder binder, Fragment body) {
        throw unsupported("Sum");
    }

    @Override
    public Fragment multiSum(List<Binder> binders, Fragment body) {
        throw unsupported("MultiSum");
    }

    @Override
    public Fragment finiteSum(String index, String bound, Fragment body) {
        throw unsupported("FiniteSum");
    }

    @Override
    public Fragment prod(String index, String bound, Fragment body) {
        throw unsupported("Prod");
    }
}
