/*
 * Copyright 2026 The Pyinfer Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.pyinfer.infer;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableList;
import com.google.pyinfer.tree.InferredValue;
import java.util.Iterator;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.nullness.Nullable;

/**
 * A lazy, finite sequence of inferred values. Values are computed only as the consumer advances,
 * so a caller that stops early does not pay for the remaining candidates.
 *
 * <p>Once exhausted, a stream reports one of three outcomes: it yielded values, it yielded
 * nothing, or it ended with a failure. A failure never hides the values yielded before it.
 */
public abstract class ValueStream extends AbstractIterator<InferredValue> {

  private static final Logger logger = Logger.getLogger(ValueStream.class.getName());

  /** How a stream ended. */
  public enum Outcome {
    /** The stream has not been exhausted yet. */
    PENDING,
    VALUES,
    EMPTY,
    FAILED
  }

  private boolean produced;
  private boolean exhausted;
  private @Nullable AnalysisException failure;

  @Override
  protected final InferredValue computeNext() {
    if (!exhausted) {
      InferredValue next = advance();
      if (next != null) {
        produced = true;
        return next;
      }
      exhausted = true;
    }
    return endOfData();
  }

  /**
   * Computes the next value.
   *
   * @return the next value, or null once there are no more; a stream ending with a failure
   *     returns {@link #fail}
   */
  protected abstract @Nullable InferredValue advance();

  /** Ends this stream with {@code failure}. */
  protected final @Nullable InferredValue fail(AnalysisException failure) {
    this.failure = checkNotNull(failure);
    return null;
  }

  public final Outcome getOutcome() {
    if (!exhausted) {
      return Outcome.PENDING;
    } else if (failure != null) {
      return Outcome.FAILED;
    }
    return produced ? Outcome.VALUES : Outcome.EMPTY;
  }

  /** The failure this stream ended with, or null if it has not failed (yet). */
  public final @Nullable AnalysisException getFailure() {
    return failure;
  }

  /**
   * Drains the stream.
   *
   * @throws AnalysisException if the stream ends with a failure
   */
  public final ImmutableList<InferredValue> toList() {
    ImmutableList<InferredValue> values = ImmutableList.copyOf(this);
    if (failure != null) {
      throw failure;
    }
    return values;
  }

  public static ValueStream of(InferredValue... values) {
    return fromIterator(ImmutableList.copyOf(values).iterator());
  }

  public static ValueStream empty() {
    return of();
  }

  public static ValueStream failed(AnalysisException failure) {
    checkNotNull(failure);
    return new ValueStream() {
      @Override
      protected @Nullable InferredValue advance() {
        return fail(failure);
      }
    };
  }

  public static ValueStream fromIterator(Iterator<? extends InferredValue> values) {
    checkNotNull(values);
    return new ValueStream() {
      @Override
      protected @Nullable InferredValue advance() {
        return values.hasNext() ? values.next() : null;
      }
    };
  }

  /** A stream whose contents are only built when it is first advanced. */
  public static ValueStream lazy(Supplier<ValueStream> supplier) {
    checkNotNull(supplier);
    return new ValueStream() {
      private @Nullable ValueStream delegate;

      @Override
      protected @Nullable InferredValue advance() {
        if (delegate == null) {
          delegate = supplier.get();
        }
        return forward(delegate);
      }
    };
  }

  /**
   * The values of each stream in turn. Streams are taken from {@code streams} only when the
   * previous one is exhausted; the first failure ends the result.
   */
  public static ValueStream concat(Iterator<ValueStream> streams) {
    checkNotNull(streams);
    return new ValueStream() {
      private @Nullable ValueStream current;

      @Override
      protected @Nullable InferredValue advance() {
        while (true) {
          if (current != null) {
            if (current.hasNext()) {
              return current.next();
            }
            if (current.getFailure() != null) {
              return fail(current.getFailure());
            }
          }
          if (!streams.hasNext()) {
            return null;
          }
          current = streams.next();
        }
      }
    };
  }

  /**
   * For each value of {@code source}, the values of {@code fn} applied to it. A failure of the
   * source or of any mapped stream ends the result.
   */
  public static ValueStream flatMap(
      ValueStream source, Function<? super InferredValue, ValueStream> fn) {
    checkNotNull(source);
    checkNotNull(fn);
    return new ValueStream() {
      private @Nullable ValueStream inner;

      @Override
      protected @Nullable InferredValue advance() {
        while (true) {
          if (inner != null) {
            if (inner.hasNext()) {
              return inner.next();
            }
            if (inner.getFailure() != null) {
              return fail(inner.getFailure());
            }
            inner = null;
          }
          if (!source.hasNext()) {
            return source.getFailure() != null ? fail(source.getFailure()) : null;
          }
          inner = fn.apply(source.next());
        }
      }
    };
  }

  /**
   * Like {@link #flatMap}, but a mapped stream that fails only drops its own remaining values.
   * Ends with {@code ifEmpty} if nothing at all was yielded.
   */
  public static ValueStream flatMapLenient(
      ValueStream source,
      Function<? super InferredValue, ValueStream> fn,
      Supplier<? extends AnalysisException> ifEmpty) {
    return failIfEmpty(
        flatMap(source, value -> dropFailure(fn.apply(value))), ifEmpty);
  }

  public static ValueStream map(
      ValueStream source, Function<? super InferredValue, ? extends InferredValue> fn) {
    checkNotNull(source);
    checkNotNull(fn);
    return new ValueStream() {
      @Override
      protected @Nullable InferredValue advance() {
        if (source.hasNext()) {
          return fn.apply(source.next());
        }
        return source.getFailure() != null ? fail(source.getFailure()) : null;
      }
    };
  }

  /** {@code source}, except that ending without any value ends with {@code ifEmpty} instead. */
  public static ValueStream failIfEmpty(
      ValueStream source, Supplier<? extends AnalysisException> ifEmpty) {
    checkNotNull(source);
    checkNotNull(ifEmpty);
    return new ValueStream() {
      private boolean any;

      @Override
      protected @Nullable InferredValue advance() {
        if (source.hasNext()) {
          any = true;
          return source.next();
        } else if (source.getFailure() != null) {
          return fail(source.getFailure());
        }
        return any ? null : fail(ifEmpty.get());
      }
    };
  }

  /** {@code source}, except that a failure is replaced by the single value {@code fallback}. */
  public static ValueStream recover(ValueStream source, InferredValue fallback) {
    checkNotNull(source);
    checkNotNull(fallback);
    return new ValueStream() {
      private boolean recovered;

      @Override
      protected @Nullable InferredValue advance() {
        if (source.hasNext()) {
          return source.next();
        }
        if (source.getFailure() != null && !recovered) {
          logger.log(Level.FINE, "Replacing failure with " + fallback, source.getFailure());
          recovered = true;
          return fallback;
        }
        return null;
      }
    };
  }

  /** {@code source}, except that its failure, if any, is logged and dropped. */
  public static ValueStream dropFailure(ValueStream source) {
    checkNotNull(source);
    return new ValueStream() {
      @Override
      protected @Nullable InferredValue advance() {
        if (source.hasNext()) {
          return source.next();
        }
        if (source.getFailure() != null) {
          logger.log(Level.FINE, "Dropping failed candidate", source.getFailure());
        }
        return null;
      }
    };
  }

  /** Yields the next value of {@code delegate}, or ends the way {@code delegate} ended. */
  protected final @Nullable InferredValue forward(ValueStream delegate) {
    if (delegate.hasNext()) {
      return delegate.next();
    }
    return delegate.getFailure() != null ? fail(delegate.getFailure()) : null;
  }
}
