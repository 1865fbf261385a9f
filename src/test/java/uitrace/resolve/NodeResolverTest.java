package uitrace.resolve;

import org.testng.annotations.BeforeClass;
import org.testng.annotations.Test;
import uitrace.model.ControlNode;
import uitrace.model.FailureKind;
import uitrace.model.NodeQuery;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link NodeResolver} against the {@code hierarchy.xml}
 * fixture.
 */
public class NodeResolverTest {

    private HierarchySnapshot snapshot;
    private NodeResolver resolver;

    @BeforeClass
    public void loadFixture() throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/fixtures/hierarchy.xml")) {
            snapshot = HierarchySnapshot.parse(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        }
        resolver = new NodeResolver();
    }

    // ── Point ─────────────────────────────────────────────────────────────

    @Test(description = "Smallest containing node wins: area 400 beats area 900")
    public void point_smallestAreaWins() {
        ControlNode node = resolver.resolve(snapshot, new NodeQuery.PointQuery(50, 50));

        assertThat(node.get("text")).isEqualTo("OK");
        assertThat(node.getBounds()).isEqualTo("[40,40][60,60]");
    }

    @Test(description = "Edges are inclusive")
    public void point_onEdge() {
        assertThat(resolver.resolve(snapshot, new NodeQuery.PointQuery(60, 60)).get("text")).isEqualTo("OK");
    }

    @Test(description = "Equal areas keep the first node in document order")
    public void point_tieKeepsFirst() {
        ControlNode node = resolver.resolve(snapshot, new NodeQuery.PointQuery(540, 500));

        assertThat(node.get("text")).isEqualTo("First");
    }

    @Test(description = "A point outside every node is a resolution failure")
    public void point_outside() {
        assertThatThrownBy(() -> resolver.resolve(snapshot, new NodeQuery.PointQuery(5000, 5000)))
                .isInstanceOf(ResolutionException.class)
                .satisfies(e -> assertThat(((ResolutionException) e).getKind()).isEqualTo(FailureKind.RESOLUTION));
    }

    // ── Bounds ────────────────────────────────────────────────────────────

    @Test(description = "Bounds match ignores whitespace in the query")
    public void bounds_whitespaceIgnored() {
        ControlNode node = resolver.resolve(snapshot, new NodeQuery.BoundsQuery("[ 100,200 ][500, 300]"));

        assertThat(node.get("resource-id")).isEqualTo("com.example.notes:id/greeting");
    }

    @Test(description = "Bounds with no matching node is a resolution failure")
    public void bounds_noMatch() {
        assertThatThrownBy(() -> resolver.resolve(snapshot, new NodeQuery.BoundsQuery("[1,1][2,2]")))
                .isInstanceOf(ResolutionException.class);
    }

    @Test(description = "normalizeBounds strips every whitespace character")
    public void normalizeBounds() {
        assertThat(NodeResolver.normalizeBounds(" [0, 0]\t[10,\n10] ")).isEqualTo("[0,0][10,10]");
        assertThat(NodeResolver.normalizeBounds(null)).isEmpty();
    }

    // ── Path ──────────────────────────────────────────────────────────────

    @Test(description = "Literal XPath over node elements resolves directly")
    public void path_literal() {
        assertThat(resolver.resolve(snapshot, new NodeQuery.PathQuery("//node[@text='Submit']")).get("content-desc"))
                .isEqualTo("submit");
    }

    @Test(description = "Class-named steps are rewritten to node[@class=...]")
    public void path_classRewrite() {
        ControlNode node = resolver.resolve(snapshot,
                new NodeQuery.PathQuery("//android.widget.TextView[@text='Second']"));

        assertThat(node.getBounds()).isEqualTo("[540,400][1080,600]");
    }

    @Test(description = "Grouped index selects the n-th match in document order")
    public void path_grouped() {
        ControlNode node = resolver.resolve(snapshot, new NodeQuery.PathQuery("(//android.widget.TextView)[3]"));

        assertThat(node.get("text")).isEqualTo("Second");
    }

    @Test(description = "Unmatched and blank paths are resolution failures")
    public void path_failures() {
        assertThatThrownBy(() -> resolver.resolve(snapshot, new NodeQuery.PathQuery("//android.widget.Switch")))
                .isInstanceOf(ResolutionException.class);
        assertThatThrownBy(() -> resolver.resolve(snapshot, new NodeQuery.PathQuery("  ")))
                .isInstanceOf(ResolutionException.class);
    }

    // ── Snapshot parsing ──────────────────────────────────────────────────

    @Test(description = "Nodes are listed in document order with all attributes")
    public void snapshot_nodes() {
        assertThat(snapshot.getNodes()).hasSize(8);
        ControlNode first = snapshot.toControlNode(snapshot.getNodes().get(0));
        assertThat(first.getAttributes())
                .containsEntry("class", "android.widget.FrameLayout")
                .containsEntry("bounds", "[0,0][1080,1920]");
    }

    @Test(description = "Resolved attributes keep the order the dump wrote them in")
    public void snapshot_attributeOrder() {
        ControlNode ok = resolver.resolve(snapshot, new NodeQuery.BoundsQuery("[40,40][60,60]"));

        assertThat(ok.getAttributes().keySet()).containsExactly(
                "index", "text", "resource-id", "class", "package", "content-desc", "clickable", "bounds");
    }

    @Test(description = "Malformed XML and DOCTYPE declarations are refused")
    public void snapshot_rejectsBadXml() {
        assertThatThrownBy(() -> HierarchySnapshot.parse("<hierarchy><node></hierarchy>"))
                .isInstanceOf(ResolutionException.class);
        assertThatThrownBy(() -> HierarchySnapshot.parse(
                "<?xml version=\"1.0\"?><!DOCTYPE x [<!ENTITY e SYSTEM \"file:///etc/passwd\">]><hierarchy>&e;</hierarchy>"))
                .isInstanceOf(ResolutionException.class);
    }
}
