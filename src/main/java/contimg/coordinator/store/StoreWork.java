package contimg.coordinator.store;

/**
 * Unit of work executed inside {@link DurableStore#transact(StoreWork)}.
 */
@FunctionalInterface
public interface StoreWork<T> {

    T execute(StoreTransaction tx);
}
