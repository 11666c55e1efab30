// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.design.cnf;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Counting constraints over sets of boolean variables, built from adder circuits.
 * Binary numbers are lists of variables (or of &plusmn;1 constants), most
 * significant bit first, unless a method says otherwise.
 */
public final class Cardinality {
    private static final Logger log = LogManager.getFormatterLogger(Cardinality.class);

    private Cardinality() {}

    /** Carry and sum outputs of an adder. */
    public static final class Bits {
        public final int carry;
        public final int sum;

        Bits(int carry, int sum) {
            this.carry = carry;
            this.sum = sum;
        }
    }

    /** Carry and sum outputs of a ripple-carry adder, least significant bit first. */
    public static final class Sums {
        public final List<Integer> carries;
        public final List<Integer> sums;

        Sums(List<Integer> carries, List<Integer> sums) {
            this.carries = Collections.unmodifiableList(carries);
            this.sums = Collections.unmodifiableList(sums);
        }
    }

    /**
     * Binary representation over the alphabet {-1, 1}, where 1 is a set bit:
     * 2 is [1, -1] and 11 is [1, -1, 1, 1]. Zero has no digits.
     */
    public static List<Integer> toBinary(int value) {
        Preconditions.checkArgument(value >= 0, "cannot represent negative value %s", value);
        List<Integer> digits = new ArrayList<>();
        for (; value != 0; value >>= 1) digits.add((value & 1) == 0 ? -1 : 1);
        return Lists.reverse(digits);
    }

    /**
     * c &harr; a &and; b, s &harr; a &oplus; b, over two fresh variables c and s.
     */
    public static Bits halfAdder(int a, int b, EncodingState state) {
        final int c = state.freshVar();
        final int s = state.freshVar();
        state.appendClauses(Clauses.iffAnd(c, ImmutableList.of(a, b)));
        List<List<Integer>> sum = new ArrayList<>(Clauses.distribute(-s, Clauses.xor(a, b)));
        sum.addAll(Clauses.distribute(s, Clauses.xnor(a, b)));
        state.appendClauses(sum);
        return new Bits(c, s);
    }

    /**
     * cout &harr; majority(a, b, cin), s &harr; a &oplus; b &oplus; cin, over two
     * fresh variables. The carry clauses are appended before the sum clauses.
     */
    public static Bits fullAdder(int a, int b, int cin, EncodingState state) {
        final int cout = state.freshVar();
        final int s = state.freshVar();

        List<List<Integer>> carry = new ArrayList<>(Clauses.distribute(-cout, ImmutableList.of(
                ImmutableList.of(a, b), ImmutableList.of(a, cin), ImmutableList.of(b, cin))));
        carry.addAll(Clauses.distribute(cout, ImmutableList.of(
                ImmutableList.of(-a, -b), ImmutableList.of(-a, -cin), ImmutableList.of(-b, -cin))));
        state.appendClauses(carry);

        // Each clause rules out one even (resp. odd) parity input row.
        List<List<Integer>> sum = new ArrayList<>(Clauses.distribute(-s, ImmutableList.of(
                ImmutableList.of(-a, -b, cin), ImmutableList.of(-a, b, -cin),
                ImmutableList.of(a, -b, -cin), ImmutableList.of(a, b, cin))));
        sum.addAll(Clauses.distribute(s, ImmutableList.of(
                ImmutableList.of(-a, -b, -cin), ImmutableList.of(-a, b, cin),
                ImmutableList.of(a, -b, cin), ImmutableList.of(a, b, -cin))));
        state.appendClauses(sum);

        return new Bits(cout, s);
    }

    /**
     * Add two binary numbers (most significant bit first). A fresh carry-in is
     * forced false, then one full adder is chained per bit pair, starting from the
     * least significant end. Bits of the longer input beyond the shorter one are
     * ignored.
     */
    public static Sums rippleCarry(List<Integer> xs, List<Integer> ys, EncodingState state) {
        int cin = state.freshVar();
        state.forceFalse(cin);
        List<Integer> carries = new ArrayList<>();
        List<Integer> sums = new ArrayList<>();
        List<Integer> rx = Lists.reverse(xs);
        List<Integer> ry = Lists.reverse(ys);
        for (int i = 0; i < rx.size() && i < ry.size(); ++i) {
            Bits b = fullAdder(rx.get(i), ry.get(i), cin, state);
            carries.add(b.carry);
            sums.add(b.sum);
            cin = b.carry;
        }
        return new Sums(carries, sums);
    }

    /**
     * The number of true variables in {@code vars}, as a binary number. The input
     * is padded with fresh variables forced false up to a power of two and summed
     * pairwise in a tree of ripple-carry adders.
     */
    public static List<Integer> popCount(List<Integer> vars, EncodingState state) {
        Preconditions.checkArgument(!vars.isEmpty(), "cannot count an empty set of variables");
        int width = 1;
        while (width < vars.size()) width <<= 1;
        List<Integer> padding = state.freshVars(width - vars.size());
        state.forceFalse(padding);
        List<List<Integer>> layer = new ArrayList<>(width);
        for (int v : vars) layer.add(ImmutableList.of(v));
        for (int v : padding) layer.add(ImmutableList.of(v));
        while (layer.size() > 1) {
            final int half = layer.size() / 2;
            List<List<Integer>> next = new ArrayList<>(half);
            for (int i = 0; i < half; ++i) {
                Sums s = rippleCarry(layer.get(i), layer.get(half + i), state);
                // The final carry becomes the new top bit.
                next.add(ImmutableList.<Integer>builder()
                        .add(s.carries.get(s.carries.size() - 1))
                        .addAll(Lists.reverse(s.sums))
                        .build());
            }
            layer = next;
        }
        return layer.get(0);
    }

    /** Exactly {@code k} of {@code vars} are true. */
    public static void assertKOfN(int k, List<Integer> vars, EncodingState state) {
        Preconditions.checkArgument(k >= 0 && k <= vars.size(),
                "cannot require %s of %s variables", k, vars.size());
        List<Integer> sum = popCount(vars, state);
        List<Integer> digits = Lists.reverse(toBinary(k));
        // Pair bits from the least significant end; missing high digits of k are zeros.
        List<List<Integer>> units = new ArrayList<>(sum.size());
        for (int i = 0; i < sum.size(); ++i) {
            int digit = i < digits.size() ? digits.get(i) : -1;
            units.add(ImmutableList.of(digit * sum.get(sum.size() - 1 - i)));
        }
        state.appendClauses(Lists.reverse(units));
    }

    /** Fewer than {@code k} of {@code vars} are true. */
    public static void kLessThanN(int k, List<Integer> vars, EncodingState state) {
        inequality(true, k, vars, state);
    }

    /** More than {@code k} of {@code vars} are true. */
    public static void kGreaterThanN(int k, List<Integer> vars, EncodingState state) {
        inequality(false, k, vars, state);
    }

    private static void inequality(boolean lessThan, int k, List<Integer> vars, EncodingState state) {
        Preconditions.checkArgument(k >= 0, "cannot compare a count with %s", k);
        List<Integer> sum = popCount(vars, state);
        List<Integer> digits = toBinary(k);
        List<Integer> kVars = state.freshVars(digits.size());
        List<List<Integer>> units = new ArrayList<>(digits.size());
        for (int i = 0; i < digits.size(); ++i) units.add(ImmutableList.of(kVars.get(i) * digits.get(i)));
        state.appendClauses(units);
        List<List<Integer>> same = makeSameLength(kVars, sum, state);
        if (lessThan) {
            assertLessThan(same.get(1), same.get(0), state);
        } else {
            assertLessThan(same.get(0), same.get(1), state);
        }
    }

    /**
     * Zero-extend {@code xs} and {@code ys} to a common width one bit wider than
     * the longer of the two, so that the two's complement negation of either fits.
     *
     * @return the extended {@code xs} and {@code ys}, in that order
     */
    static List<List<Integer>> makeSameLength(List<Integer> xs, List<Integer> ys, EncodingState state) {
        if (xs.size() < ys.size()) {
            List<Integer> padding = state.freshVars(ys.size() - xs.size() + 1);
            state.forceFalse(padding);
            List<Integer> xs1 = concat(padding, xs);
            List<Integer> oneMore = state.freshVars(1);
            state.forceFalse(oneMore);
            return ImmutableList.of(xs1, concat(oneMore, ys));
        } else {
            List<Integer> padding = state.freshVars(xs.size() - ys.size() + 1);
            state.forceFalse(padding);
            List<Integer> ys1 = concat(padding, ys);
            List<Integer> oneMore = state.freshVars(1);
            state.forceFalse(oneMore);
            return ImmutableList.of(concat(oneMore, xs), ys1);
        }
    }

    /**
     * k &lt; n, by asserting the sign bit of k + (-n). Both inputs must have the
     * same width, with a leading zero.
     */
    static void assertLessThan(List<Integer> k, List<Integer> n, EncodingState state) {
        Sums s = rippleCarry(k, toNegTwosComp(n, state), state);
        state.forceTrue(s.sums.get(s.sums.size() - 1));
    }

    /**
     * The two's complement negation of a binary number: fresh variables equal to
     * the complemented bits, plus one.
     */
    static List<Integer> toNegTwosComp(List<Integer> bits, EncodingState state) {
        List<Integer> flipped = state.freshVars(bits.size());
        List<List<Integer>> flip = new ArrayList<>(2 * bits.size());
        for (int i = 0; i < bits.size(); ++i) flip.addAll(Clauses.doubleImplies(flipped.get(i), -bits.get(i)));
        state.appendClauses(flip);
        List<Integer> one = state.freshVars(bits.size());
        state.forceFalse(one.subList(0, one.size() - 1));
        state.forceTrue(one.get(one.size() - 1));
        return Lists.reverse(rippleCarry(flipped, one, state).sums);
    }

    private static List<Integer> concat(List<Integer> high, List<Integer> low) {
        return ImmutableList.<Integer>builder().addAll(high).addAll(low).build();
    }

    /**
     * Encode one request into {@code state}.
     */
    public static void apply(CardinalityRequest request, EncodingState state) {
        log.debug("applying %s", request);
        switch (request.comparison()) {
            case EQ:
                assertKOfN(request.k(), request.vars(), state);
                break;
            case LT:
                kLessThanN(request.k(), request.vars(), state);
                break;
            case GT:
                kGreaterThanN(request.k(), request.vars(), state);
                break;
            default:
                throw new IllegalArgumentException("unknown comparison: " + request.comparison());
        }
    }

    /**
     * Encode a batch of requests on top of an existing clause set.
     *
     * @param fresh    the last variable used by {@code clauses}
     * @param clauses  clauses produced elsewhere, in emission order
     * @param requests counting constraints to add
     * @param support  number of independent variables (1..support) to declare
     * @return the combined formula: the caller's clauses followed by the
     *         request clauses in the order the requests were given
     */
    public static CnfFormula process(int fresh, List<List<Integer>> clauses,
                                     List<CardinalityRequest> requests, int support) {
        EncodingState state = EncodingState.startingAt(fresh);
        for (CardinalityRequest r : requests) apply(r, state);
        List<List<Integer>> all = new ArrayList<>(clauses);
        all.addAll(state.clausesInCallOrder());
        return new CnfFormula(state.lastVar(), all, support);
    }
}
