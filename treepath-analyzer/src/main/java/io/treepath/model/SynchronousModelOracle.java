package io.treepath.model;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Base class for oracles whose answers are available immediately, e.g. from an in-memory schema.
 * Failures thrown by the lookup methods are delivered as exceptionally completed stages.
 */
public abstract class SynchronousModelOracle implements ModelOracle {

  /** Returns the named type, or null. */
  protected abstract TypeInfo lookupType(String name);

  /** Returns the property type, or null. */
  protected abstract TypeInfo lookupElementType(TypeInfo parent, String propertyName);

  /** Returns the narrowed type, or null. */
  protected abstract TypeInfo narrow(TypeInfo type, String targetName);

  /** Returns the property names, possibly empty. */
  protected abstract List<String> lookupElementNames(TypeInfo parent);

  @Override
  public final CompletionStage<TypeInfo> getType(String name) {
    try {
      return CompletableFuture.completedFuture(lookupType(name));
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  @Override
  public final CompletionStage<TypeInfo> getElementType(TypeInfo parent, String propertyName) {
    try {
      return CompletableFuture.completedFuture(lookupElementType(parent, propertyName));
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  @Override
  public final CompletionStage<TypeInfo> narrowToType(TypeInfo type, String targetName) {
    try {
      return CompletableFuture.completedFuture(narrow(type, targetName));
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  @Override
  public final CompletionStage<List<String>> listElementNames(TypeInfo parent) {
    try {
      List<String> names = lookupElementNames(parent);
      return CompletableFuture.completedFuture(names == null ? List.of() : names);
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
  }
}
