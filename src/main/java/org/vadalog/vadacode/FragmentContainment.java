package org.vadalog.vadacode;

import java.util.*;

/**
 * Containment lattice of the Datalog+/- fragments. {@link #PARENTS} maps a
 * fragment to the more general fragments it is directly contained in; every
 * other relation is derived from it.
 */
public final class FragmentContainment {

    private static final Map<Fragment, List<Fragment>> PARENTS = new EnumMap<>(Fragment.class);

    static {
        PARENTS.put(Fragment.SHOW_ALL_VIOLATIONS, List.of(Fragment.LINEAR, Fragment.PLAIN_DATALOG));
        PARENTS.put(Fragment.LINEAR,
                List.of(Fragment.AFRATI_LINEAR, Fragment.WARDED, Fragment.SHY, Fragment.GUARDED));
        PARENTS.put(Fragment.AFRATI_LINEAR, List.of(Fragment.WARDED));
        PARENTS.put(Fragment.PLAIN_DATALOG, List.of(Fragment.WARDED, Fragment.SHY));
        PARENTS.put(Fragment.WARDED, List.of(Fragment.WEAKLY_FRONTIER_GUARDED));
        PARENTS.put(Fragment.SHY, List.of(Fragment.DATALOG_EXISTENTIAL));
        PARENTS.put(Fragment.GUARDED, List.of(Fragment.FRONTIER_GUARDED, Fragment.WEAKLY_GUARDED));
        PARENTS.put(Fragment.FRONTIER_GUARDED, List.of(Fragment.WEAKLY_FRONTIER_GUARDED));
        PARENTS.put(Fragment.WEAKLY_GUARDED, List.of(Fragment.WEAKLY_FRONTIER_GUARDED));
        PARENTS.put(Fragment.WEAKLY_FRONTIER_GUARDED, List.of(Fragment.DATALOG_EXISTENTIAL));
        PARENTS.put(Fragment.DATALOG_EXISTENTIAL, List.of());
    }

    private FragmentContainment() {
    }

    public static List<Fragment> parentsOf(Fragment fragment) {
        return PARENTS.get(fragment);
    }

    /**
     * All fragments the given one is nested inside, excluding itself.
     */
    public static Set<Fragment> ancestorsOf(Fragment fragment) {
        Set<Fragment> ancestors = EnumSet.noneOf(Fragment.class);
        Deque<Fragment> pending = new ArrayDeque<>(PARENTS.get(fragment));
        while (!pending.isEmpty()) {
            Fragment parent = pending.pop();
            if (ancestors.add(parent)) {
                pending.addAll(PARENTS.get(parent));
            }
        }
        return ancestors;
    }

    /**
     * All fragments nested inside the given one.
     */
    public static Set<Fragment> childrenOf(Fragment fragment) {
        Set<Fragment> children = EnumSet.noneOf(Fragment.class);
        for (Fragment candidate : Fragment.values()) {
            if (ancestorsOf(candidate).contains(fragment)) {
                children.add(candidate);
            }
        }
        return children;
    }

    /**
     * Violations propagate from a fragment to every fragment nested inside
     * it. The most specific fragments are the still valid ones that no other
     * still valid fragment is nested inside.
     */
    public static FragmentClassification classify(Collection<VadalogDiagnostic> diagnostics) {
        Set<Fragment> directlyViolated = EnumSet.noneOf(Fragment.class);
        for (VadalogDiagnostic diagnostic : diagnostics) {
            if (diagnostic.getFragmentViolation() != null) {
                directlyViolated.add(diagnostic.getFragmentViolation());
            }
        }

        Set<Fragment> allViolated = EnumSet.noneOf(Fragment.class);
        allViolated.addAll(directlyViolated);
        for (Fragment violated : directlyViolated) {
            allViolated.addAll(childrenOf(violated));
        }

        List<Fragment> stillValid = new ArrayList<>();
        for (Fragment fragment : Fragment.values()) {
            if (fragment != Fragment.SHOW_ALL_VIOLATIONS && !allViolated.contains(fragment)) {
                stillValid.add(fragment);
            }
        }

        List<Fragment> mostSpecific = new ArrayList<>();
        for (Fragment candidate : stillValid) {
            boolean generalizesAnother = false;
            for (Fragment other : stillValid) {
                if (ancestorsOf(other).contains(candidate)) {
                    generalizesAnother = true;
                    break;
                }
            }
            if (!generalizesAnother) {
                mostSpecific.add(candidate);
            }
        }
        return new FragmentClassification(stillValid, mostSpecific);
    }

    /**
     * The first most specific still valid fragment, {@code Datalog ∃} when
     * every fragment is violated.
     */
    public static Fragment detectFragment(Collection<VadalogDiagnostic> diagnostics) {
        List<Fragment> mostSpecific = classify(diagnostics).getMostSpecific();
        return mostSpecific.isEmpty() ? Fragment.DATALOG_EXISTENTIAL : mostSpecific.get(0);
    }

    /**
     * For every fragment, the fragments whose violations also break it.
     */
    public static Map<Fragment, Set<Fragment>> applicableFragments(boolean includeSelf) {
        Map<Fragment, Set<Fragment>> result = new EnumMap<>(Fragment.class);
        for (Fragment fragment : Fragment.values()) {
            Set<Fragment> applicable = ancestorsOf(fragment);
            if (includeSelf) {
                applicable.add(fragment);
            }
            result.put(fragment, Collections.unmodifiableSet(applicable));
        }
        return result;
    }

    /**
     * Outcome of {@link #classify}: both lists follow fragment declaration order.
     */
    public static final class FragmentClassification {
        private final List<Fragment> stillValid;
        private final List<Fragment> mostSpecific;

        FragmentClassification(List<Fragment> stillValid, List<Fragment> mostSpecific) {
            this.stillValid = Collections.unmodifiableList(stillValid);
            this.mostSpecific = Collections.unmodifiableList(mostSpecific);
        }

        public List<Fragment> getStillValid() { return stillValid; }
        public List<Fragment> getMostSpecific() { return mostSpecific; }

        @Override
        public String toString() {
            return "FragmentClassification{stillValid=" + stillValid + ", mostSpecific=" + mostSpecific + "}";
        }
    }
}
