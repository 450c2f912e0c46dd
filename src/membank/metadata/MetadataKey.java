package membank.metadata;

/**
 * Identifies one kind of metadata slot in a {@link MetadataStore}.
 * Keys are compared by identity; each metadata kind should have exactly one key object.
 * @param <T> the type of value stored under this key
 */
public final class MetadataKey<T> {
  private final String name;
  private final Class<?> valueClass;

  public MetadataKey(String name, Class<?> valueClass) {
    this.name = name;
    this.valueClass = valueClass;
  }

  public String getName() { return name; }

  @SuppressWarnings("unchecked")
  T cast(Object value) {
    if (value != null && !valueClass.isInstance(value))
      throw new ClassCastException("Metadata " + name + " holds a " + value.getClass().getName() + ", expected " + valueClass.getName());
    return (T)value;
  }

  @Override
  public String toString() {
    return name;
  }
}
