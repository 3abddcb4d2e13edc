package org.rtlgraph.frontend.xml;

import org.rtlgraph.frontend.ast.AssignKind;
import org.rtlgraph.frontend.ast.AssignNode;
import org.rtlgraph.frontend.ast.AstNode;
import org.rtlgraph.frontend.ast.BeginNode;
import org.rtlgraph.frontend.ast.BreakNode;
import org.rtlgraph.frontend.ast.CaseItemNode;
import org.rtlgraph.frontend.ast.CaseNode;
import org.rtlgraph.frontend.ast.ConstNode;
import org.rtlgraph.frontend.ast.ContinueNode;
import org.rtlgraph.frontend.ast.DeclarationNode;
import org.rtlgraph.frontend.ast.DesignNode;
import org.rtlgraph.frontend.ast.IfNode;
import org.rtlgraph.frontend.ast.InstanceNode;
import org.rtlgraph.frontend.ast.LoopKind;
import org.rtlgraph.frontend.ast.LoopNode;
import org.rtlgraph.frontend.ast.ModuleNode;
import org.rtlgraph.frontend.ast.Operator;
import org.rtlgraph.frontend.ast.OperatorNode;
import org.rtlgraph.frontend.ast.PortConnectionNode;
import org.rtlgraph.frontend.ast.PortDeclNode;
import org.rtlgraph.frontend.ast.PortDirection;
import org.rtlgraph.frontend.ast.ProcessKind;
import org.rtlgraph.frontend.ast.ProcessNode;
import org.rtlgraph.frontend.ast.SensitivityNode;
import org.rtlgraph.frontend.ast.SourceLocation;
import org.rtlgraph.frontend.ast.TernaryNode;
import org.rtlgraph.frontend.ast.UnknownNode;
import org.rtlgraph.frontend.ast.VarRefNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Reads the XML written by {@code verilator --xml-only} into the syntax-tree variants.
 *
 * <p>Modules are taken from {@code netlist/module}, or from any {@code module} element when the
 * document has no netlist. Tags are matched case-insensitively, including the aliases older
 * and newer Verilator releases use. Anything without a dedicated variant becomes an
 * {@link UnknownNode} and is counted; only an unreadable document fails the read.</p>
 *
 * <p>Instances are single-use: create one reader per document.</p>
 */
public final class VerilatorXmlReader {

    private static final Logger log = LoggerFactory.getLogger(VerilatorXmlReader.class);

    private static final Set<String> BLOCKING_ASSIGN = Set.of("assign", "blockingassign");
    private static final Set<String> NON_BLOCKING_ASSIGN = Set.of("assigndly", "nonblockingassign");
    private static final Set<String> CONTINUOUS_ASSIGN = Set.of("contassign", "continuousassign", "assignw", "assignalias");
    private static final Set<String> DECLARATION_TAGS = Set.of("var", "decl", "param", "genvar", "localparam");
    private static final Set<String> IF_TAGS = Set.of("if", "ifstmt");
    private static final Set<String> CASE_TAGS = Set.of("case", "casestmt");
    private static final Set<String> CASE_ITEM_TAGS = Set.of("caseitem", "item");
    private static final Set<String> INSTANCE_TAGS = Set.of("cell", "instance");
    private static final Set<String> PIN_TAGS = Set.of("pin", "port");
    private static final Set<String> VARREF_TAGS = Set.of("varref", "varxref");
    private static final Map<String, ProcessKind> PROCESS_TAGS = Map.ofEntries(
            Map.entry("always", ProcessKind.ALWAYS),
            Map.entry("always_comb", ProcessKind.ALWAYS_COMB),
            Map.entry("alwayscomb", ProcessKind.ALWAYS_COMB),
            Map.entry("always_ff", ProcessKind.ALWAYS_FF),
            Map.entry("alwaysff", ProcessKind.ALWAYS_FF),
            Map.entry("always_latch", ProcessKind.ALWAYS_LATCH),
            Map.entry("alwayslatch", ProcessKind.ALWAYS_LATCH),
            Map.entry("initial", ProcessKind.INITIAL),
            Map.entry("final", ProcessKind.FINAL),
            Map.entry("function", ProcessKind.FUNCTION),
            Map.entry("func", ProcessKind.FUNCTION),
            Map.entry("task", ProcessKind.TASK));
    private static final Map<String, LoopKind> LOOP_TAGS = Map.of(
            "for", LoopKind.FOR,
            "while", LoopKind.WHILE,
            "repeat", LoopKind.REPEAT,
            "dowhile", LoopKind.DO_WHILE);

    private int unrecognizedCount;

    /**
     * Reads a document from a file.
     *
     * @param path The XML file.
     * @return The design.
     * @throws AstReadException if the file cannot be read or parsed.
     */
    public DesignNode read(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return read(in, path.toString());
        } catch (IOException e) {
            throw new AstReadException("Cannot read syntax tree " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Reads a document from a stream. The stream is not closed.
     *
     * @param in         The XML content.
     * @param sourceName Name used in messages.
     * @return The design.
     * @throws AstReadException if the content is not well-formed or contains no module.
     */
    public DesignNode read(InputStream in, String sourceName) {
        Document document;
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setExpandEntityReferences(false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            document = builder.parse(in);
        } catch (ParserConfigurationException | SAXException | IOException e) {
            throw new AstReadException("Malformed syntax tree " + sourceName + ": " + e.getMessage(), e);
        }
        return read(document, sourceName);
    }

    /**
     * Reads an already parsed document.
     */
    public DesignNode read(Document document, String sourceName) {
        Element root = document.getDocumentElement();
        List<Element> moduleElements = new ArrayList<>();
        Element netlist = firstChild(root, "netlist");
        if (netlist != null) {
            moduleElements.addAll(children(netlist, "module"));
        }
        if (moduleElements.isEmpty()) {
            NodeList all = document.getElementsByTagName("module");
            for (int i = 0; i < all.getLength(); i++) {
                moduleElements.add((Element) all.item(i));
            }
        }
        if (moduleElements.isEmpty()) {
            throw new AstReadException("No module found in syntax tree " + sourceName);
        }

        List<ModuleNode> modules = new ArrayList<>();
        for (Element element : moduleElements) {
            modules.add(readModule(element));
        }
        log.debug("Read {} module(s) from {} ({} unrecognized element(s))", modules.size(), sourceName, unrecognizedCount);
        return new DesignNode(modules);
    }

    /**
     * Number of elements read as {@link UnknownNode} so far.
     */
    public int getUnrecognizedCount() {
        return unrecognizedCount;
    }

    private ModuleNode readModule(Element element) {
        List<AstNode> items = new ArrayList<>();
        for (Element child : children(element)) {
            items.add(readNode(child));
        }
        return new ModuleNode(attribute(element, "name"), items, locationOf(element));
    }

    private AstNode readNode(Element element) {
        String tag = tagOf(element);
        SourceLocation location = locationOf(element);

        if (VARREF_TAGS.contains(tag)) {
            return new VarRefNode(attribute(element, "name"), location);
        }
        if (tag.equals("const")) {
            String value = attribute(element, "name");
            return new ConstNode(value != null ? value : attribute(element, "value"));
        }
        if (DECLARATION_TAGS.contains(tag)) {
            return readDeclaration(element, tag, location);
        }
        if (BLOCKING_ASSIGN.contains(tag)) {
            return readAssign(element, AssignKind.BLOCKING, location);
        }
        if (NON_BLOCKING_ASSIGN.contains(tag)) {
            return readAssign(element, AssignKind.NON_BLOCKING, location);
        }
        if (CONTINUOUS_ASSIGN.contains(tag)) {
            return readAssign(element, AssignKind.CONTINUOUS, location);
        }
        if (PROCESS_TAGS.containsKey(tag)) {
            return readProcess(element, PROCESS_TAGS.get(tag), location);
        }
        if (tag.equals("begin")) {
            return new BeginNode(attribute(element, "name"), readAll(children(element)), location);
        }
        if (IF_TAGS.contains(tag)) {
            return readIf(element, location);
        }
        if (CASE_TAGS.contains(tag)) {
            return readCase(element, location);
        }
        if (LOOP_TAGS.containsKey(tag)) {
            return readLoop(element, LOOP_TAGS.get(tag), location);
        }
        if (tag.equals("break")) {
            return new BreakNode(location);
        }
        if (tag.equals("continue")) {
            return new ContinueNode(location);
        }
        if (INSTANCE_TAGS.contains(tag)) {
            return readInstance(element, location);
        }
        if ((tag.equals("cond") || tag.equals("condbound")) && children(element).size() == 3) {
            List<Element> parts = children(element);
            return new TernaryNode(readNode(parts.get(0)), readNode(parts.get(1)), readNode(parts.get(2)));
        }
        Operator operator = Operator.fromTag(tag);
        if (operator != null) {
            return new OperatorNode(operator, readAll(children(element)), location);
        }
        return readUnknown(element, tag, location);
    }

    private AstNode readDeclaration(Element element, String tag, SourceLocation location) {
        String name = attribute(element, "name");
        String direction = attribute(element, "dir");
        if (direction == null) {
            direction = attribute(element, "direction");
        }
        if (direction != null && !direction.isEmpty()) {
            return new PortDeclNode(name, PortDirection.normalize(direction), location);
        }
        return new DeclarationNode(tag, name, location);
    }

    private AstNode readAssign(Element element, AssignKind kind, SourceLocation location) {
        List<AstNode> parts = readAll(children(element));
        if (parts.isEmpty()) {
            return new AssignNode(kind, List.of(), null, location);
        }
        // Verilator writes the right-hand side first and the target last.
        return new AssignNode(kind, parts.subList(0, parts.size() - 1), parts.get(parts.size() - 1), location);
    }

    private AstNode readProcess(Element element, ProcessKind kind, SourceLocation location) {
        SensitivityNode sensitivity = null;
        List<AstNode> body = new ArrayList<>();
        for (Element child : children(element)) {
            String tag = tagOf(child);
            if (tag.equals("sentree")) {
                sensitivity = readSensitivity(child);
            } else if (tag.equals("senitem")) {
                sensitivity = merge(sensitivity, readSenItem(child));
            } else {
                body.add(readNode(child));
            }
        }
        return new ProcessNode(kind, attribute(element, "name"), sensitivity, body, location);
    }

    private SensitivityNode readSensitivity(Element element) {
        List<SensitivityNode.SenItem> items = new ArrayList<>();
        for (Element child : children(element)) {
            if (tagOf(child).equals("senitem")) {
                items.add(readSenItem(child));
            }
        }
        return new SensitivityNode(items);
    }

    private SensitivityNode.SenItem readSenItem(Element element) {
        List<Element> parts = children(element);
        AstNode signal = parts.isEmpty() ? null : readNode(parts.get(0));
        return new SensitivityNode.SenItem(edgeOf(element), signal);
    }

    private static SensitivityNode merge(SensitivityNode existing, SensitivityNode.SenItem item) {
        List<SensitivityNode.SenItem> items = new ArrayList<>();
        if (existing != null) {
            items.addAll(existing.items());
        }
        items.add(item);
        return new SensitivityNode(items);
    }

    private static String edgeOf(Element element) {
        String type = attribute(element, "type");
        if (type != null) {
            String lower = type.toLowerCase(Locale.ROOT);
            if (lower.equals("posedge") || lower.equals("negedge") || lower.equals("bothedge")) {
                return lower;
            }
        }
        String edgeType = attribute(element, "edgeType");
        if (edgeType != null) {
            return switch (edgeType.toUpperCase(Locale.ROOT)) {
                case "POS", "POSEDGE" -> "posedge";
                case "NEG", "NEGEDGE" -> "negedge";
                case "BOTH", "BOTHEDGE" -> "bothedge";
                default -> null;
            };
        }
        return null;
    }

    private AstNode readIf(Element element, SourceLocation location) {
        Element cond = conditionWrapper(element);
        Element then = firstChild(element, "then");
        Element otherwise = firstChild(element, "else");
        if (cond != null || then != null || otherwise != null) {
            AstNode condition = cond != null ? unwrap(cond) : firstExpression(element, then, otherwise);
            return new IfNode(condition, wrapStatements(then), wrapStatements(otherwise), location);
        }
        List<Element> parts = children(element);
        AstNode condition = parts.size() > 0 ? readNode(parts.get(0)) : null;
        AstNode thenBranch = parts.size() > 1 ? readNode(parts.get(1)) : null;
        AstNode elseBranch = parts.size() > 2 ? readNode(parts.get(2)) : null;
        return new IfNode(condition, thenBranch, elseBranch, location);
    }

    private AstNode readCase(Element element, SourceLocation location) {
        AstNode selector = null;
        List<CaseItemNode> items = new ArrayList<>();
        Element expr = firstChild(element, "expr");
        if (expr != null) {
            selector = unwrap(expr);
        }
        for (Element child : children(element)) {
            String tag = tagOf(child);
            if (CASE_ITEM_TAGS.contains(tag)) {
                items.add(readCaseItem(child));
            } else if (selector == null && !tag.equals("expr")) {
                selector = readNode(child);
            }
        }
        return new CaseNode(selector, items, location);
    }

    private CaseItemNode readCaseItem(Element element) {
        List<AstNode> values = new ArrayList<>();
        List<AstNode> statements = new ArrayList<>();
        String value = attribute(element, "value");
        boolean explicitValue = value != null;
        if (explicitValue && !value.equalsIgnoreCase("default")) {
            values.add(new ConstNode(value));
        }
        for (Element child : children(element)) {
            AstNode node = readNode(child);
            if (!explicitValue && statements.isEmpty() && isExpression(node)) {
                values.add(node);
            } else {
                statements.add(node);
            }
        }
        return new CaseItemNode(values, statements, locationOf(element));
    }

    private AstNode readLoop(Element element, LoopKind kind, SourceLocation location) {
        List<AstNode> init = new ArrayList<>();
        AstNode condition = null;
        List<AstNode> body = new ArrayList<>();

        Element cond = conditionWrapper(element);
        Element bodyElement = firstChild(element, "body");
        boolean conditionSeen = false;
        for (Element child : children(element)) {
            if (child == bodyElement) {
                continue;
            }
            if (child == cond) {
                condition = unwrap(cond);
                conditionSeen = true;
                continue;
            }
            if (tagOf(child).equals("init")) {
                init.addAll(readAll(children(child)));
                continue;
            }
            AstNode node = readNode(child);
            if (!conditionSeen && cond == null && isExpression(node)) {
                condition = node;
                conditionSeen = true;
            } else if (!conditionSeen) {
                init.add(node);
            } else if (bodyElement == null) {
                body.add(node);
            }
        }
        if (bodyElement != null) {
            body.addAll(readAll(children(bodyElement)));
        }
        return new LoopNode(kind, init, condition, body, location);
    }

    private AstNode readInstance(Element element, SourceLocation location) {
        String moduleType = attribute(element, "defName");
        if (moduleType == null) {
            moduleType = attribute(element, "submodname");
        }
        if (moduleType == null) {
            moduleType = attribute(element, "modName");
        }
        List<PortConnectionNode> ports = new ArrayList<>();
        for (Element child : children(element)) {
            if (PIN_TAGS.contains(tagOf(child))) {
                List<Element> parts = children(child);
                String direction = attribute(child, "direction");
                if (direction == null) {
                    direction = attribute(child, "dir");
                }
                ports.add(new PortConnectionNode(attribute(child, "name"), direction,
                        parts.isEmpty() ? null : readNode(parts.get(0))));
            }
        }
        return new InstanceNode(attribute(element, "name"), moduleType, ports, location);
    }

    private AstNode readUnknown(Element element, String tag, SourceLocation location) {
        unrecognizedCount++;
        Map<String, String> attributes = new LinkedHashMap<>();
        NamedNodeMap map = element.getAttributes();
        for (int i = 0; i < map.getLength(); i++) {
            Node attr = map.item(i);
            attributes.put(attr.getNodeName(), attr.getNodeValue());
        }
        return new UnknownNode(tag, attributes, readAll(children(element)), location);
    }

    /**
     * Returns the single child of a wrapper element such as {@code cond} or {@code expr}, or a
     * generic node for multiple children.
     */
    private AstNode unwrap(Element wrapper) {
        if (wrapper == null) {
            return null;
        }
        List<Element> parts = children(wrapper);
        if (parts.size() == 1) {
            return readNode(parts.get(0));
        }
        return parts.isEmpty() ? null : readUnknown(wrapper, tagOf(wrapper), locationOf(wrapper));
    }

    /**
     * Reads the statements of a {@code then}/{@code else} wrapper as a single statement.
     */
    private AstNode wrapStatements(Element wrapper) {
        if (wrapper == null) {
            return null;
        }
        List<AstNode> statements = readAll(children(wrapper));
        if (statements.isEmpty()) {
            return null;
        }
        return statements.size() == 1 ? statements.get(0) : new BeginNode(null, statements, locationOf(wrapper));
    }

    /**
     * Returns the {@code cond} wrapper child, ignoring a three-operand {@code cond}, which is a
     * ternary expression.
     */
    private static Element conditionWrapper(Element parent) {
        Element cond = firstChild(parent, "cond");
        return cond != null && children(cond).size() != 3 ? cond : null;
    }

    private List<AstNode> readAll(List<Element> elements) {
        List<AstNode> nodes = new ArrayList<>(elements.size());
        for (Element element : elements) {
            nodes.add(readNode(element));
        }
        return nodes;
    }

    /**
     * Reads the first expression child outside the given wrappers, the condition of an
     * {@code if} that wraps only its branches.
     */
    private AstNode firstExpression(Element parent, Element... skipped) {
        List<Element> excluded = Arrays.asList(skipped);
        for (Element child : children(parent)) {
            if (excluded.contains(child)) {
                continue;
            }
            if (isExpressionElement(child)) {
                return readNode(child);
            }
        }
        return null;
    }

    private static boolean isExpressionElement(Element element) {
        String tag = tagOf(element);
        return VARREF_TAGS.contains(tag) || tag.equals("const") || Operator.fromTag(tag) != null
                || ((tag.equals("cond") || tag.equals("condbound")) && children(element).size() == 3);
    }

    private static boolean isExpression(AstNode node) {
        return node instanceof VarRefNode || node instanceof ConstNode
                || node instanceof OperatorNode || node instanceof TernaryNode;
    }

    // --- DOM helpers ---

    private static String tagOf(Element element) {
        return element.getTagName().toLowerCase(Locale.ROOT);
    }

    private static String attribute(Element element, String name) {
        return element.hasAttribute(name) ? element.getAttribute(name) : null;
    }

    private static SourceLocation locationOf(Element element) {
        return SourceLocation.parse(attribute(element, "loc"));
    }

    private static List<Element> children(Element parent) {
        List<Element> result = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            if (nodes.item(i) instanceof Element element) {
                result.add(element);
            }
        }
        return result;
    }

    private static List<Element> children(Element parent, String tag) {
        List<Element> result = new ArrayList<>();
        for (Element child : children(parent)) {
            if (tagOf(child).equals(tag)) {
                result.add(child);
            }
        }
        return result;
    }

    private static Element firstChild(Element parent, String tag) {
        for (Element child : children(parent)) {
            if (tagOf(child).equals(tag)) {
                return child;
            }
        }
        return null;
    }
}
