package com.example.translator.adapter.upstream;

import java.util.Optional;

/**
 * Pull-based view of one provider response. {@link #close()} may be called from another thread
 * to abort a blocked {@link #next()}.
 */
public interface FragmentStream extends AutoCloseable {

  /**
   * Blocks until the next text fragment arrives.
   *
   * @return the fragment, or empty once the provider has finished
   * @throws com.example.translator.exception.UpstreamException if the provider fails mid-stream
   */
  Optional<String> next();

  @Override
  void close();
}
