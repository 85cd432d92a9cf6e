package br.edu.ifba.agentflow.component;

import br.edu.ifba.agentflow.engine.WorkflowEngine;
import br.edu.ifba.agentflow.exception.UnknownComponentTypeException;
import br.edu.ifba.agentflow.graph.ComponentTypeCatalog;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Maps component type names to their parameter and component factories.
 */
public class ComponentRegistry implements ComponentTypeCatalog {

    /**
     * Creates a component from bound parameters.
     */
    @FunctionalInterface
    public interface ComponentFactory<P extends ComponentParam> {
        Component<P> create(String id, P param, WorkflowEngine engine, ComponentServices services);
    }

    private record Registration<P extends ComponentParam>(
        Supplier<P> paramFactory,
        ComponentFactory<P> componentFactory
    ) {
        Component<P> activate(String id, @Nullable Map<String, Object> params,
                              WorkflowEngine engine, ComponentServices services) {
            P param = paramFactory.get();
            param.update(params, services.objectMapper());
            Component<P> component = componentFactory.create(id, param, engine, services);
            component.check();
            return component;
        }
    }

    private final Map<String, Registration<?>> registrations = new LinkedHashMap<>();

    public <P extends ComponentParam> ComponentRegistry register(
            @NotNull String componentName,
            @NotNull Supplier<P> paramFactory,
            @NotNull ComponentFactory<P> componentFactory) {
        Objects.requireNonNull(componentName, "componentName must not be null");
        registrations.put(componentName, new Registration<>(
            Objects.requireNonNull(paramFactory, "paramFactory must not be null"),
            Objects.requireNonNull(componentFactory, "componentFactory must not be null")));
        return this;
    }

    @Override
    public boolean isRegistered(String componentName) {
        return componentName != null && registrations.containsKey(componentName);
    }

    @NotNull
    public Set<String> componentNames() {
        return Collections.unmodifiableSet(registrations.keySet());
    }

    /**
     * Binds the node parameters, builds the component and validates it.
     *
     * @throws UnknownComponentTypeException if the type is not registered
     * @throws br.edu.ifba.agentflow.exception.ConfigurationException if validation fails
     */
    @NotNull
    public Component<?> activate(@NotNull String id, @NotNull String componentName,
                                 @Nullable Map<String, Object> params,
                                 @NotNull WorkflowEngine engine, @NotNull ComponentServices services) {
        Registration<?> registration = registrations.get(componentName);
        if (registration == null) {
            throw new UnknownComponentTypeException("Unknown component type: " + componentName);
        }
        return registration.activate(id, params, engine, services);
    }
}
