package com.docrender.core.operation;

import com.docrender.core.error.CallbackException;

import java.util.Comparator;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Invokes user supplied functions behind a catch boundary.
 *
 * <p>Any {@link RuntimeException} thrown by a callback becomes a {@link CallbackException} that
 * names the operation and the callback, with the original exception as cause.
 */
public final class Callbacks {

    private Callbacks() {
    }

    /**
     * Calls a supplier, converting failures.
     *
     * @param operation operation name
     * @param callback callback description, e.g. {@code "predicate"}
     * @param call the call
     * @param <T> result type
     * @return the callback result
     */
    public static <T> T invoke(String operation, String callback, Supplier<T> call) {
        try {
            return call.get();
        } catch (CallbackException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CallbackException(operation, callback, e);
        }
    }

    /**
     * Wraps a row predicate.
     *
     * @param operation operation name
     * @param predicate user predicate
     * @return guarded predicate
     */
    public static Predicate<Map<String, Object>> guard(String operation, Predicate<Map<String, Object>> predicate) {
        return row -> invoke(operation, "predicate", () -> predicate.test(row));
    }

    /**
     * Wraps a row comparator.
     *
     * @param operation operation name
     * @param comparator user comparator
     * @return guarded comparator
     */
    public static Comparator<Map<String, Object>> guard(String operation, Comparator<Map<String, Object>> comparator) {
        return (left, right) -> invoke(operation, "comparator", () -> comparator.compare(left, right));
    }

    /**
     * Wraps a row function.
     *
     * @param operation operation name
     * @param callback callback description
     * @param function user function
     * @return guarded function
     */
    public static Function<Map<String, Object>, Object> guard(
            String operation, String callback, Function<Map<String, Object>, Object> function) {
        return row -> invoke(operation, callback, () -> function.apply(row));
    }
}
