package membank.instance;

import java.util.Objects;
import java.util.Optional;

/**
 * Port assignment of one unrolled access instance.
 * <p>
 * The mux port is the time multiplexed slot the access has in reference to all other accesses on the same buffer port.
 * The buffer port is the port the access connects to on an N-buffer. If the buffer has depth 1, it is always Some(0).
 * If the access occurs outside of the metapipeline that uses the buffer, it is None.
 * <pre>
 *            |--------------|--------------|
 *            |   Buffer 0   |   Buffer 1   |
 *            |--------------|--------------|
 * bufferPort         0              1           The buffer port (None for access outside pipeline)
 * muxSize            3              3           Width of a single time multiplexed vector
 *                 |x x x|        |x x x|
 *
 *                /       \      /       \
 *
 *              |x x x|x x|     |x x x|x x x|
 * muxPort         0    1          0     1       The ID for the given time multiplexed vector
 *
 *              |( ) O|O O|    |(   )|( ) O|
 * muxOfs        0   2 0 1        0    0  2      Start offset into the time multiplexed vector
 * </pre>
 * broadcast is 0 for an access that drives its own lanes, and k &gt; 0 for the k-th access sharing the lanes of an
 * earlier access with the same address.
 */
public final class Port {
  private final Optional<Integer> bufferPort;
  private final int muxPort;
  private final int muxSize;
  private final int muxOfs;
  private final int broadcast;

  public Port(Optional<Integer> bufferPort, int muxPort, int muxSize, int muxOfs, int broadcast) {
    if (muxPort < 0 || broadcast < 0)
      throw new IllegalArgumentException("muxPort and broadcast must not be negative");
    if (muxOfs < 0 || muxOfs >= muxSize)
      throw new IllegalArgumentException(String.format("muxOfs %d out of range for muxSize %d", muxOfs, muxSize));
    if (bufferPort.isPresent() && bufferPort.get() < 0)
      throw new IllegalArgumentException("bufferPort must not be negative");
    this.bufferPort = bufferPort;
    this.muxPort = muxPort;
    this.muxSize = muxSize;
    this.muxOfs = muxOfs;
    this.broadcast = broadcast;
  }

  public Optional<Integer> getBufferPort() { return bufferPort; }
  public int getMuxPort() { return muxPort; }
  public int getMuxSize() { return muxSize; }
  public int getMuxOfs() { return muxOfs; }
  public int getBroadcast() { return broadcast; }

  @Override
  public int hashCode() {
    return Objects.hash(bufferPort, muxPort, muxSize, muxOfs, broadcast);
  }
  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || getClass() != obj.getClass())
      return false;
    Port other = (Port)obj;
    return bufferPort.equals(other.bufferPort) && muxPort == other.muxPort && muxSize == other.muxSize && muxOfs == other.muxOfs &&
        broadcast == other.broadcast;
  }
  @Override
  public String toString() {
    return String.format("Port(buffer: %s, mux: %d, size: %d, ofs: %d, broadcast: %d)", bufferPort.map(String::valueOf).orElse("None"),
                         muxPort, muxSize, muxOfs, broadcast);
  }
}
