package br.edu.ifba.agentflow.graph;

/**
 * Set of component type names a graph may reference.
 */
@FunctionalInterface
public interface ComponentTypeCatalog {

    boolean isRegistered(String componentName);
}
