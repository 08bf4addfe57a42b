package se.alipsa.jrecmap;

import java.util.Objects;
import java.util.function.Function;

/**
 * Translates between application record keys and storage column names.
 *
 * <p>
 * {@code decode} turns a storage name into an application key and {@code encode} turns an application key into a
 * storage name. The two functions are expected to be each other's inverse for the names a schema actually uses, but
 * this is never checked: every conversion simply applies whichever function it was given.
 * </p>
 *
 * @param decoder
 *          storage name to application key
 * @param encoder
 *          application key to storage name
 */
public record KeyMapper(Function<String, String> decoder, Function<String, String> encoder) {

  private static final KeyMapper IDENTITY = new KeyMapper(Function.identity(), Function.identity());

  /**
   * Validate the supplied functions.
   *
   * @param decoder
   *          storage name to application key
   * @param encoder
   *          application key to storage name
   */
  public KeyMapper {
    Objects.requireNonNull(decoder, "decoder");
    Objects.requireNonNull(encoder, "encoder");
  }

  /**
   * Create a key mapper from a decode and an encode function.
   *
   * @param decoder
   *          storage name to application key
   * @param encoder
   *          application key to storage name
   * @return a new key mapper
   */
  public static KeyMapper of(Function<String, String> decoder, Function<String, String> encoder) {
    return new KeyMapper(decoder, encoder);
  }

  /**
   * A key mapper where application keys and storage names are the same.
   *
   * @return the identity key mapper
   */
  public static KeyMapper identity() {
    return IDENTITY;
  }

  /**
   * Translate a storage name to an application key.
   *
   * @param storageName
   *          the column name used by the storage engine
   * @return the application key
   */
  public String decode(String storageName) {
    return decoder.apply(storageName);
  }

  /**
   * Translate an application key to a storage name.
   *
   * @param key
   *          the application record key
   * @return the storage column name
   */
  public String encode(String key) {
    return encoder.apply(key);
  }
}
