package kiln.engine.handler;

/**
 * Body of one task type. Runs on a worker thread and must not touch pool state.
 *
 * @param <P> payload type the task data is converted to
 * @param <R> result type
 */
public interface TaskHandler<P, R> {

    /** Task type this handler serves, e.g. {@code hash_file}. */
    String type();

    /** Class the raw task data is converted to before {@link #handle} is called. */
    Class<P> payloadType();

    R handle(P payload) throws Exception;

    /**
     * Function form of a handler body.
     */
    @FunctionalInterface
    interface Body<P, R> {
        R apply(P payload) throws Exception;
    }

    /**
     * Build a handler from a lambda.
     */
    static <P, R> TaskHandler<P, R> of(String type, Class<P> payloadType, Body<P, R> body) {
        return new TaskHandler<>() {
            @Override
            public String type() {
                return type;
            }

            @Override
            public Class<P> payloadType() {
                return payloadType;
            }

            @Override
            public R handle(P payload) throws Exception {
                return body.apply(payload);
            }
        };
    }
}
