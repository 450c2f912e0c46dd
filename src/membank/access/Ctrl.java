package membank.access;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A control scope (controller) of the program. Children are ordered; for a pipelined controller (metapipe),
 * the position of a child is its pipeline stage.
 * Compared by identity.
 */
public class Ctrl {
  private final String name;
  private final Optional<Ctrl> parent;
  private final ArrayList<Ctrl> children = new ArrayList<>();

  /** Constructs a root controller. */
  public Ctrl(String name) { this(name, Optional.empty()); }
  private Ctrl(String name, Optional<Ctrl> parent) {
    this.name = name;
    this.parent = parent;
  }

  /** Creates a new child controller after all existing children. */
  public Ctrl addChild(String childName) {
    Ctrl child = new Ctrl(childName, Optional.of(this));
    children.add(child);
    return child;
  }

  public String getName() { return name; }
  public Optional<Ctrl> getParent() { return parent; }
  public List<Ctrl> getChildren() { return Collections.unmodifiableList(children); }

  /** Determines if this controller is other or one of its descendants. */
  public boolean isWithin(Ctrl other) {
    Ctrl cur = this;
    while (true) {
      if (cur == other)
        return true;
      if (cur.parent.isEmpty())
        return false;
      cur = cur.parent.get();
    }
  }

  /**
   * Returns the stage of metapipe that contains this controller,
   * i.e. the index of the child of metapipe that this controller is or lies within.
   * @param metapipe the pipelined ancestor
   * @return the stage index, or an empty Optional if this controller is not strictly inside metapipe
   */
  public Optional<Integer> stageWithin(Ctrl metapipe) {
    Ctrl cur = this;
    while (cur.parent.isPresent()) {
      Ctrl curParent = cur.parent.get();
      if (curParent == metapipe)
        return Optional.of(metapipe.children.indexOf(cur));
      cur = curParent;
    }
    return Optional.empty();
  }

  @Override
  public String toString() {
    return name;
  }
}
