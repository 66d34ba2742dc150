package kiln.engine.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import kiln.engine.exception.UnknownTaskTypeException;
import kiln.engine.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Fixed map from task type to handler, shared read-only by all workers.
 * Task data is converted to the handler's payload type with Jackson, so JSON
 * trees, maps and already-typed payloads are all accepted.
 */
public final class TaskHandlerRegistry {

    private static final Logger log = LoggerFactory.getLogger(TaskHandlerRegistry.class);

    private static final ObjectMapper MAPPER = new ObjectMapper().findAndRegisterModules();

    private final Map<String, TaskHandler<?, ?>> handlers;

    private TaskHandlerRegistry(Map<String, TaskHandler<?, ?>> handlers) {
        this.handlers = Collections.unmodifiableMap(new LinkedHashMap<>(handlers));
    }

    /**
     * Registry with the built-in file handlers.
     */
    public static TaskHandlerRegistry defaults() {
        return builder()
                .register(new HashFileHandler())
                .register(new CompressFileHandler())
                .register(new AnalyzeCodeHandler())
                .register(new SearchInFileHandler())
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean supports(String type) {
        return handlers.containsKey(type);
    }

    public Set<String> types() {
        return handlers.keySet();
    }

    /**
     * Run the handler registered for the task's type.
     *
     * @throws UnknownTaskTypeException if no handler is registered
     * @throws IllegalArgumentException if the data cannot be converted to the payload type
     */
    public Object execute(Task task) throws Exception {
        TaskHandler<?, ?> handler = handlers.get(task.type());
        if (handler == null) {
            throw new UnknownTaskTypeException(task.id(), task.type());
        }
        return invoke(handler, task);
    }

    private static <P> Object invoke(TaskHandler<P, ?> handler, Task task) throws Exception {
        P payload = convert(task.data(), handler.payloadType());
        log.trace("Running {} for task {}", handler.type(), task.id());
        return handler.handle(payload);
    }

    private static <P> P convert(Object data, Class<P> type) {
        if (data == null || type.isInstance(data)) {
            return type.cast(data);
        }
        return MAPPER.convertValue(data, type);
    }

    public static final class Builder {
        private final Map<String, TaskHandler<?, ?>> handlers = new LinkedHashMap<>();

        public Builder register(TaskHandler<?, ?> handler) {
            if (handler.type() == null || handler.type().isBlank()) {
                throw new IllegalArgumentException("handler type is required");
            }
            if (handlers.putIfAbsent(handler.type(), handler) != null) {
                throw new IllegalArgumentException("handler already registered for type: " + handler.type());
            }
            return this;
        }

        public TaskHandlerRegistry build() {
            return new TaskHandlerRegistry(handlers);
        }
    }
}
