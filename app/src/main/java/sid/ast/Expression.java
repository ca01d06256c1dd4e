package sid.ast;

/** Immutable SID expression tree: either a named {@link Atom} or an {@link Op} with children. */
public sealed interface Expression permits Atom, Op {

  default boolean isAtom() {
    return this instanceof Atom;
  }
}
