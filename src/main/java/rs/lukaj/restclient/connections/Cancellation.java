package rs.lukaj.restclient.connections;

/**
 * Lets the caller abort an exchange which is in progress, e.g. because its deadline has passed.
 */
public interface Cancellation {
    Cancellation NONE = new Cancellation() {
        @Override
        public boolean isCancelled() {
            return false;
        }

        @Override
        public Registration onCancel(Runnable action) {
            return () -> {};
        }
    };

    boolean isCancelled();

    /**
     * Registers an action which runs once cancellation happens. If already cancelled, the action runs right away.
     * @return handle used to unregister the action when it's no longer needed
     */
    Registration onCancel(Runnable action);

    interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
