package sid.diagram;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import sid.ast.OperatorTag;

/** One operator instance in a diagram. */
public record Node(
    String id,
    OperatorTag operator,
    List<String> inputs,
    List<String> dofRefs,
    boolean irreversible,
    Map<String, Object> metadata) {

  public static final String ATOM_ARGS = "atom_args";
  public static final String RULE_ID = "rule_id";

  public Node {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(operator, "operator");
    inputs = inputs == null ? List.of() : List.copyOf(inputs);
    dofRefs = dofRefs == null ? List.of() : List.copyOf(dofRefs);
    metadata =
        metadata == null || metadata.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  public static Node of(String id, OperatorTag operator) {
    return new Node(id, operator, List.of(), List.of(), operator.irreversible(), Map.of());
  }

  public Node withInputs(List<String> newInputs) {
    return new Node(id, operator, newInputs, dofRefs, irreversible, metadata);
  }

  public Node withDofRefs(List<String> newDofRefs) {
    return new Node(id, operator, inputs, newDofRefs, irreversible, metadata);
  }

  public Node withMetadata(Map<String, Object> newMetadata) {
    return new Node(id, operator, inputs, dofRefs, irreversible, newMetadata);
  }

  public boolean isLeaf() {
    return inputs.isEmpty();
  }

  /** Atom names recorded under {@link #ATOM_ARGS}, or an empty list. */
  public List<String> atomArgs() {
    Object raw = metadata.get(ATOM_ARGS);
    if (!(raw instanceof List<?> list)) {
      return List.of();
    }
    return list.stream().map(String::valueOf).toList();
  }
}
