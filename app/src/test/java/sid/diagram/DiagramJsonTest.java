package sid.diagram;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import sid.ast.OperatorTag;
import sid.errors.ErrorCode;
import sid.errors.StructuralException;
import sid.parse.ExpressionParser;

final class DiagramJsonTest {

  @Test
  void encodesEveryNodeAndEdgeField() {
    Diagram diagram = DiagramBuilder.build(ExpressionParser.parse("O(P(Choice))"));
    JsonObject json = JsonParser.parseString(DiagramJson.toJson(diagram)).getAsJsonObject();

    assertEquals("d_expr", json.get("id").getAsString());
    assertFalse(json.has("compartment_id"));
    JsonObject leaf = json.getAsJsonArray("nodes").get(0).getAsJsonObject();
    assertEquals("P", leaf.get("op").getAsString());
    assertEquals("Choice", leaf.getAsJsonArray("dof_refs").get(0).getAsString());
    assertFalse(leaf.has("meta"), "Empty metadata is omitted");
    JsonObject collapse = json.getAsJsonArray("nodes").get(1).getAsJsonObject();
    assertTrue(collapse.get("irreversible").getAsBoolean());
    JsonObject edge = json.getAsJsonArray("edges").get(0).getAsJsonObject();
    assertEquals("arg", edge.get("label").getAsString());
    assertEquals(0, edge.get("port").getAsInt());
  }

  @Test
  void decodesWhatItEncodes() {
    Diagram diagram = new Diagram("custom");
    diagram.setCompartmentId("room");
    diagram.addNode(Node.of("a", OperatorTag.S_MINUS).withDofRefs(List.of("X", "Y")));
    diagram.addNode(
        Node.of("b", OperatorTag.T)
            .withInputs(List.of("a"))
            .withMetadata(Map.of(Node.RULE_ID, "r1")));
    diagram.addEdge(new Edge("e", "a", "b", "flow", 0));

    Diagram decoded = DiagramJson.fromJson(DiagramJson.toPrettyJson(diagram));
    assertEquals(diagram, decoded);
  }

  @Test
  void acceptsToPortAndDefaults() {
    String json =
        "{\"nodes\":[{\"id\":\"a\",\"op\":\"P\"},{\"id\":\"b\",\"op\":\"O\",\"inputs\":[\"a\"]}],"
            + "\"edges\":[{\"id\":\"e\",\"from\":\"a\",\"to\":\"b\",\"to_port\":2}]}";
    Diagram diagram = DiagramJson.fromJson(json);

    assertEquals(DiagramJson.DEFAULT_ID, diagram.id());
    assertTrue(diagram.findNode("b").orElseThrow().irreversible(), "O defaults to irreversible");
    Edge edge = diagram.edges().get(0);
    assertEquals(2, edge.port());
    assertEquals(Edge.DEFAULT_LABEL, edge.label());
  }

  @Test
  void acceptsEdgeNamedLikeANode() {
    String json =
        "{\"nodes\":[{\"id\":\"a\",\"op\":\"P\"},"
            + "{\"id\":\"b\",\"op\":\"T\",\"inputs\":[\"a\"]}],"
            + "\"edges\":[{\"id\":\"a\",\"from\":\"a\",\"to\":\"b\"}]}";
    Diagram diagram = DiagramJson.fromJson(json);

    assertEquals(2, diagram.nodeCount());
    assertEquals("a", diagram.edges().get(0).id());
  }

  @Test
  void rejectsMalformedDocuments() {
    List<String> payloads =
        List.of(
            "not json at all {",
            "[]",
            "{\"id\":\"d\"}",
            "{\"nodes\":[{\"id\":\"a\",\"op\":\"X\"}]}",
            "{\"nodes\":[{\"id\":\"\",\"op\":\"P\"}]}",
            "{\"nodes\":[{\"id\":\"a\",\"op\":\"P\",\"inputs\":\"b\"}]}",
            "{\"nodes\":[{\"id\":\"a\",\"op\":\"P\",\"irreversible\":\"yes\"}]}",
            "{\"nodes\":[{\"id\":\"a\",\"op\":\"P\"}],"
                + "\"edges\":[{\"id\":\"e\",\"from\":\"a\",\"to\":\"z\"}]}",
            "{\"nodes\":[{\"id\":\"a\",\"op\":\"P\"},{\"id\":\"a\",\"op\":\"T\"}]}",
            "{\"nodes\":[{\"id\":\"a\",\"op\":\"T\"}],"
                + "\"edges\":[{\"id\":\"e\",\"from\":\"a\",\"to\":\"a\",\"port\":-1}]}",
            "{\"nodes\":[{\"id\":\"a\",\"op\":\"T\"},{\"id\":\"b\",\"op\":\"T\"}],"
                + "\"edges\":[{\"id\":\"e1\",\"from\":\"a\",\"to\":\"b\"},"
                + "{\"id\":\"e2\",\"from\":\"b\",\"to\":\"a\"}]}");
    for (String payload : payloads) {
      StructuralException ex =
          assertThrows(
              StructuralException.class, () -> DiagramJson.fromJson(payload), "Payload " + payload);
      assertEquals(ErrorCode.STRUCTURAL_ERROR, ex.code());
    }
  }
}
