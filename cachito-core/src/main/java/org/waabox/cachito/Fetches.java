package org.waabox.cachito;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * Static helpers for calling fetch ports and inspecting their failures.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Fetches {

  /** Private constructor to prevent instantiation. */
  private Fetches() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Calls a fetcher, turning a synchronous throw or a null future into an
   * exceptionally completed future.
   *
   * @param call the fetcher invocation, never null
   * @param <R>  the type of the fetched value
   *
   * @return the fetcher's future, never null
   */
  public static <R> CompletableFuture<R> invoke(
      final Supplier<CompletableFuture<R>> call) {
    Objects.requireNonNull(call, "call must not be null");
    try {
      final CompletableFuture<R> future = call.get();
      if (future == null) {
        return CompletableFuture.failedFuture(
            new IllegalStateException("Fetcher returned a null future"));
      }
      return future;
    } catch (final RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  /**
   * Strips the {@link CompletionException} and {@link ExecutionException}
   * wrappers that asynchronous pipelines add around a failure.
   *
   * @param error the failure as observed, never null
   *
   * @return the innermost meaningful cause, never null
   */
  public static Throwable unwrap(final Throwable error) {
    Objects.requireNonNull(error, "error must not be null");
    Throwable current = error;
    while ((current instanceof CompletionException
        || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }
}
