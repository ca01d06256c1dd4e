package sid.rewrite;

/** Outcome category of a rewrite attempt. */
public enum RewriteStatus {
  APPLIED,
  NOT_APPLICABLE,
  REJECTED_CYCLE
}
