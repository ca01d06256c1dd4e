package sid.ssp;

/** Mass category owned by a {@link SemanticProcessor}: Included, Negated or Undecided. */
public enum Role {
  I,
  N,
  U
}
