package com.quantori.csp.api.service;

/**
 * An item writer handing processed items (reaction documents) to a storage or any other consumer
 * outside of the platform.
 *
 * @param <T> item type, currently {@link com.quantori.csp.api.model.document.ReactionDocument}
 */
public interface ItemWriter<T> extends AutoCloseable {

  /**
   * Write a single item.
   *
   * @param item an item to store
   */
  void write(T item);

  /**
   * Flush buffered items.
   */
  void flush();

  /**
   * Close the writer and persist all items.
   */
  @Override
  void close();
}
