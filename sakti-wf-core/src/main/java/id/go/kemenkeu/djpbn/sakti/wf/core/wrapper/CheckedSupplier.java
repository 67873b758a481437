package id.go.kemenkeu.djpbn.sakti.wf.core.wrapper;

/**
 * Supplier that may throw checked exceptions.
 */
@FunctionalInterface
public interface CheckedSupplier<T> {
    T get() throws Exception;
}
