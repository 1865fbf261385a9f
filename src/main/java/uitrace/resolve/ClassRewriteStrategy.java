package uitrace.resolve;

import org.w3c.dom.Element;

import java.util.Optional;

/**
 * Hierarchy dumps tag every element {@code node} and keep the widget type in
 * {@code class}, so {@code //android.widget.TextView[@text='OK']} is rewritten
 * to {@code .//node[@class='android.widget.TextView' and @text='OK']}.
 */
public class ClassRewriteStrategy implements PathStrategy {

    @Override
    public String name() { return "class-rewrite"; }

    @Override
    public Optional<Element> find(HierarchySnapshot snapshot, String path) {
        return XPathSupport.classRewrite(path)
                .flatMap(expr -> XPathSupport.evaluateFirst(snapshot, expr));
    }
}
