package org.l5xst.l5x;

import static org.l5xst.l5x.L5xDocuments.*;

import java.util.*;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import org.l5xst.ConversionException;
import org.l5xst.ErrorKind;
import org.l5xst.ir.IR;
import org.l5xst.model.Controller;

/**
 * Turns an L5X element tree into a {@link Controller}.
 */
public class L5xLoader {
    /*
     * Logger
     */
    private static final Logger log = LogManager.getLogger("l5x");

    private static final Set<String> IMPLICIT_PARAMS = Set.of("EnableIn", "EnableOut");
    private static final Set<String> IGNORED_SHEET_ELEMENTS = Set.of("TextBox", "ICon", "OCon", "Attachment");

    public Controller load(Document doc) {
        Element root = doc.getDocumentElement();
        if (!root.getTagName().equals("RSLogix5000Content")) {
            throw fail("document", "root element is <" + root.getTagName() + ">", "expected <RSLogix5000Content>");
        }
        Element controller = child(root, "Controller")
            .orElseThrow(() -> fail("document", "no <Controller> element", "export the whole controller, not a component"));
        String name = required(controller, "Name", "Controller");
        log.debug("loading controller {}", name);

        var types = grandchildren(controller, "DataTypes", "DataType").stream()
            .map(this::readDataType)
            .toList();
        var addOns = grandchildren(controller, "AddOnInstructionDefinitions", "AddOnInstructionDefinition").stream()
            .map(e -> readAddOn(e, name))
            .toList();
        var tags = grandchildren(controller, "Tags", "Tag").stream()
            .map(e -> readTag(e, IR.SCOPE.CONTROLLER))
            .toList();
        var programs = grandchildren(controller, "Programs", "Program").stream()
            .map(e -> readProgram(e, name))
            .toList();

        return new Controller(name, tags, types, addOns, programs);
    }

    // ==========================================================
    // Declarations
    // ==========================================================

    private Controller.DataType readDataType(Element e) {
        String name = required(e, "Name", "DataType");
        var members = new ArrayList<Controller.Member>();
        for (var m : grandchildren(e, "Members", "Member")) {
            if (attr(m, "Hidden").map(Boolean::parseBoolean).orElse(false)) {
                continue;
            }
            members.add(new Controller.Member(
                required(m, "Name", "Member of " + name),
                required(m, "DataType", "Member of " + name),
                dims(attr(m, "Dimension").orElse("0"))
            ));
        }
        return new Controller.DataType(name, members);
    }

    private Controller.AddOn readAddOn(Element e, String controller) {
        String name = required(e, "Name", "AddOnInstructionDefinition");
        var params = new ArrayList<Controller.AddOnParam>();
        for (var p : grandchildren(e, "Parameters", "Parameter")) {
            String pName = required(p, "Name", "Parameter of " + name);
            if (IMPLICIT_PARAMS.contains(pName)) {
                continue;
            }
            var usage = switch (attr(p, "Usage").orElse("Input")) {
                case "Output" -> Controller.USAGE.OUTPUT;
                case "InOut" -> Controller.USAGE.IN_OUT;
                default -> Controller.USAGE.INPUT;
            };
            params.add(new Controller.AddOnParam(pName, required(p, "DataType", "Parameter " + pName), usage));
        }
        var locals = grandchildren(e, "LocalTags", "LocalTag").stream()
            .map(t -> readTag(t, IR.SCOPE.PROGRAM))
            .toList();
        var routines = readRoutines(e, controller + "/" + name);
        return new Controller.AddOn(name, params, locals, routines);
    }

    private Controller.Tag readTag(Element e, IR.SCOPE scope) {
        String name = required(e, "Name", "Tag");
        var kind = switch (attr(e, "TagType").orElse("Base")) {
            case "Alias" -> IR.TAG_KIND.ALIAS;
            case "Produced" -> IR.TAG_KIND.PRODUCED;
            case "Consumed" -> IR.TAG_KIND.CONSUMED;
            default -> IR.TAG_KIND.BASE;
        };
        var aliasFor = attr(e, "AliasFor");
        if (kind == IR.TAG_KIND.ALIAS && aliasFor.isEmpty()) {
            throw fail("Tag " + name, "alias without AliasFor", "alias tags must name their target");
        }
        String dataType = attr(e, "DataType").orElse(kind == IR.TAG_KIND.ALIAS ? "" : null);
        if (dataType == null) {
            throw fail("Tag " + name, "missing DataType", "every base tag declares its data type");
        }
        var value = attr(e, "Value")
            .or(() -> descendant(e, "DataValue").flatMap(v -> attr(v, "Value")))
            .map(v -> normalizeValue(dataType, v));
        var message = descendant(e, "MessageParameters").map(this::readMessage);
        var dims = dims(attr(e, "Dimensions").orElse(attr(e, "Dimension").orElse("0")));
        return new Controller.Tag(name, dataType, dims, scope, kind, value, aliasFor, message);
    }

    private IR.Message readMessage(Element e) {
        String path = attr(e, "ConnectionPath").orElse("");
        int cut = path.length();
        for (int i = 0; i < path.length(); i++) {
            if (path.charAt(i) == ',' || path.charAt(i) == ':') {
                cut = i;
                break;
            }
        }
        return new IR.Message(
            path.substring(0, cut).strip(),
            attr(e, "LocalElement").orElse(""),
            attr(e, "RemoteElement").orElse(""),
            attr(e, "MessageType").orElse("").contains("Write")
        );
    }

    private Controller.Program readProgram(Element e, String controller) {
        String name = required(e, "Name", "Program");
        var tags = grandchildren(e, "Tags", "Tag").stream()
            .map(t -> readTag(t, IR.SCOPE.PROGRAM))
            .toList();
        return new Controller.Program(
            name,
            attr(e, "MainRoutineName"),
            tags,
            readRoutines(e, controller + "/" + name)
        );
    }

    // ==========================================================
    // Routines
    // ==========================================================

    private List<Controller.Routine> readRoutines(Element owner, String location) {
        var routines = new ArrayList<Controller.Routine>();
        for (var r : grandchildren(owner, "Routines", "Routine")) {
            String name = required(r, "Name", "Routine in " + location);
            String type = attr(r, "Type").orElse("");
            String where = location + "/" + name;
            switch (type) {
                case "RLL" -> routines.add(readLadder(r, name, where));
                case "FBD" -> routines.add(readFbd(r, name, where));
                case "ST" -> routines.add(readText(r, name));
                case "SFC" -> log.warn("{}: sequential function charts are not translated, routine skipped", where);
                default -> throw fail(where, "unknown routine type '" + type + "'", "expected RLL, FBD, ST or SFC");
            }
        }
        return routines;
    }

    private Controller.LadderRoutine readLadder(Element r, String name, String where) {
        var rungs = new ArrayList<Controller.Rung>();
        for (var rung : grandchildren(r, "RLLContent", "Rung")) {
            int number = Integer.parseInt(attr(rung, "Number").orElse(Integer.toString(rungs.size())));
            String text = child(rung, "Text").map(Element::getTextContent).orElse("").strip();
            if (text.isEmpty()) {
                continue;
            }
            var comment = child(rung, "Comment").map(c -> c.getTextContent().strip());
            var network = RungTextParser.parse(text, where + " rung " + number);
            rungs.add(new Controller.Rung(number, text, comment, network));
        }
        return new Controller.LadderRoutine(name, rungs);
    }

    private Controller.FbdRoutine readFbd(Element r, String name, String where) {
        var sheets = new ArrayList<Controller.Sheet>();
        for (var sheet : grandchildren(r, "FBDContent", "Sheet")) {
            int number = Integer.parseInt(attr(sheet, "Number").orElse(Integer.toString(sheets.size() + 1)));
            var elements = new ArrayList<Controller.SheetElement>();
            var ignored = new HashSet<String>();
            var wires = new ArrayList<Controller.Wire>();
            for (var e : children(sheet)) {
                String sheetWhere = where + " sheet " + number;
                switch (e.getTagName()) {
                    case "IRef" -> elements.add(new Controller.InputRef(
                        required(e, "ID", sheetWhere), required(e, "Operand", sheetWhere)));
                    case "ORef" -> elements.add(new Controller.OutputRef(
                        required(e, "ID", sheetWhere), required(e, "Operand", sheetWhere)));
                    case "Block", "Function" -> elements.add(new Controller.Block(
                        required(e, "ID", sheetWhere),
                        required(e, "Type", sheetWhere),
                        attr(e, "Operand").orElse(""),
                        false,
                        Map.of()));
                    case "AddOnInstruction" -> {
                        var arguments = new LinkedHashMap<String, String>();
                        for (var p : children(e, "InOutParameter")) {
                            arguments.put(required(p, "Name", sheetWhere), required(p, "Argument", sheetWhere));
                        }
                        elements.add(new Controller.Block(
                            required(e, "ID", sheetWhere),
                            required(e, "Name", sheetWhere),
                            required(e, "Operand", sheetWhere),
                            true,
                            arguments));
                    }
                    case "Wire" -> wires.add(new Controller.Wire(
                        required(e, "FromID", sheetWhere), attr(e, "FromParam"),
                        required(e, "ToID", sheetWhere), attr(e, "ToParam")));
                    default -> {
                        if (!IGNORED_SHEET_ELEMENTS.contains(e.getTagName())) {
                            log.warn("{}: unknown sheet element <{}> ignored", sheetWhere, e.getTagName());
                        }
                        attr(e, "ID").ifPresent(ignored::add);
                    }
                }
            }
            var kept = wires.stream()
                .filter(w -> !ignored.contains(w.fromId()) && !ignored.contains(w.toId()))
                .toList();
            if (kept.size() < wires.size()) {
                log.warn("{} sheet {}: {} wire(s) to connectors or annotations dropped",
                    where, number, wires.size() - kept.size());
            }
            sheets.add(new Controller.Sheet(number, elements, kept));
        }
        return new Controller.FbdRoutine(name, sheets);
    }

    private Controller.TextRoutine readText(Element r, String name) {
        var lines = new TreeMap<Integer, String>();
        var content = grandchildren(r, "STContent", "Line");
        for (int i = 0; i < content.size(); i++) {
            var line = content.get(i);
            int number = attr(line, "Number").map(Integer::parseInt).orElse(i);
            lines.put(number, line.getTextContent());
        }
        return new Controller.TextRoutine(name, String.join("\n", lines.values()));
    }

    // ==========================================================
    // Helpers
    // ==========================================================

    private static List<Integer> dims(String text) {
        var dims = new ArrayList<Integer>();
        for (var part : text.strip().split("[\\s,]+")) {
            if (part.isEmpty()) continue;
            int size = Integer.parseInt(part);
            if (size > 0) {
                dims.add(size);
            }
        }
        return dims;
    }

    private static String normalizeValue(String dataType, String value) {
        if (dataType.equalsIgnoreCase("BOOL") || dataType.equalsIgnoreCase("BIT")) {
            if (value.equals("0")) return "FALSE";
            if (value.equals("1")) return "TRUE";
        }
        return value;
    }

    private String required(Element e, String attribute, String what) {
        return attr(e, attribute)
            .filter(v -> !v.isBlank())
            .orElseThrow(() -> fail(what, "<" + e.getTagName() + "> without " + attribute, "the exporter always writes it"));
    }

    RuntimeException fail(String location, String err, String hint) {
        return new ConversionException(ErrorKind.MALFORMED_SOURCE_TREE, location, err, hint);
    }
}
