package org.l5xst.l5x;

import static org.l5xst.l5x.L5xDocuments.*;

import java.util.*;
import java.util.stream.Collectors;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import org.l5xst.ConversionConfig;
import org.l5xst.ir.IR;
import org.l5xst.st.StEmitter;
import org.l5xst.st.StPrinter;
import org.l5xst.tables.TypeTable;

/**
 * Writes an IR program as an L5X controller whose logic is all Structured Text routines.
 */
public class L5xEmitter {
    /*
     * Logger
     */
    private static final Logger log = LogManager.getLogger("l5x");

    static final String SCHEMA_REVISION = "1.0";
    static final String SOFTWARE_REVISION = "32.00";
    static final String AOI_ROUTINE = "Logic";

    private final ConversionConfig config;

    public L5xEmitter(ConversionConfig config) {
        this.config = config;
    }

    public Document emit(IR.Program program) {
        Document doc = newDocument();
        Element root = doc.createElement("RSLogix5000Content");
        root.setAttribute("SchemaRevision", SCHEMA_REVISION);
        root.setAttribute("SoftwareRevision", SOFTWARE_REVISION);
        root.setAttribute("TargetName", program.name());
        root.setAttribute("TargetType", "Controller");
        root.setAttribute("ContainsContext", "false");
        doc.appendChild(root);

        var controller = append(root, "Controller", "Use", "Target", "Name", program.name());

        var dataTypes = append(controller, "DataTypes");
        for (var type : program.types()) {
            dataType(dataTypes, type);
        }

        var addOns = append(controller, "AddOnInstructionDefinitions");
        for (var function : program.functions()) {
            addOn(addOns, function);
        }

        var controllerTags = append(controller, "Tags");
        var programVars = new ArrayList<IR.Var>();
        for (var v : program.vars()) {
            if (v.scope() == IR.SCOPE.PROGRAM) {
                programVars.add(v);
            } else {
                tag(controllerTags, "Tag", v);
            }
        }

        var programs = append(controller, "Programs");
        var main = append(programs, "Program",
            "Name", config.sourceProgramName(),
            "TestEdits", "false",
            "MainRoutineName", config.sourceRoutineName(),
            "Disabled", "false");
        var tags = append(main, "Tags");
        programVars.forEach(v -> tag(tags, "Tag", v));
        var routines = append(main, "Routines");
        var names = new HashSet<String>();
        for (int i = 0; i < program.routines().size(); i++) {
            var routine = program.routines().get(i);
            var name = i == 0 ? config.sourceRoutineName() : routineName(routine.name(), names);
            names.add(name.toLowerCase(Locale.ROOT));
            textRoutine(routines, name, routine.body());
        }

        var tasks = append(controller, "Tasks");
        var task = append(tasks, "Task",
            "Name", config.sourceTaskName(),
            "Type", "CONTINUOUS",
            "Priority", "10",
            "Watchdog", "500",
            "DisableUpdateOutputs", "false",
            "InhibitTask", "false");
        var scheduled = append(task, "ScheduledPrograms");
        append(scheduled, "ScheduledProgram", "Name", config.sourceProgramName());

        log.debug("emitted controller {}: {} tags, {} types, {} add-on instructions, {} routines",
            program.name(), program.vars().size(), program.types().size(),
            program.functions().size(), program.routines().size());
        return doc;
    }

    // ==========================================================
    // Declarations
    // ==========================================================

    private void dataType(Element parent, IR.Struct type) {
        var e = append(parent, "DataType", "Name", type.name(), "Family", "NoFamily", "Class", "User");
        var members = append(e, "Members");
        for (var m : type.members()) {
            append(members, "Member",
                "Name", m.name(),
                "DataType", TypeTable.toSource(m.type()),
                "Dimension", m.dims().isEmpty() ? "0" : dims(m.dims()),
                "Radix", radix(m.type()),
                "Hidden", "false",
                "ExternalAccess", "Read/Write");
        }
    }

    private void addOn(Element parent, IR.Function function) {
        var e = append(parent, "AddOnInstructionDefinition", "Name", function.name(), "Revision", "1.0");
        var params = append(e, "Parameters");
        var locals = append(e, "LocalTags");
        for (var p : function.params()) {
            if (p.dir() == IR.PARAM_DIR.LOCAL) {
                append(locals, "LocalTag", "Name", p.name(), "DataType", TypeTable.toSource(p.type()));
                continue;
            }
            var usage = switch (p.dir()) {
                case OUTPUT -> "Output";
                case IN_OUT -> "InOut";
                default -> "Input";
            };
            append(params, "Parameter",
                "Name", p.name(),
                "TagType", "Base",
                "DataType", TypeTable.toSource(p.type()),
                "Usage", usage,
                "Required", "true",
                "Visible", "true");
        }
        textRoutine(append(e, "Routines"), AOI_ROUTINE, function.body());
    }

    private void tag(Element parent, String element, IR.Var v) {
        if (v.kind() == IR.TAG_KIND.ALIAS && v.aliasFor().isPresent()) {
            append(parent, element, "Name", v.name(), "TagType", "Alias", "AliasFor", v.aliasFor().get());
            return;
        }
        var e = append(parent, element,
            "Name", v.name(),
            "TagType", tagType(v.kind()),
            "DataType", TypeTable.toSource(v.type()));
        if (!v.dims().isEmpty()) {
            e.setAttribute("Dimensions", dims(v.dims()));
        }
        if (v.message().isPresent()) {
            var msg = v.message().get();
            var data = append(e, "Data", "Format", "Message");
            append(data, "MessageParameters",
                "MessageType", msg.write() ? "CIP Data Table Write" : "CIP Data Table Read",
                "LocalElement", msg.localElement(),
                "RemoteElement", msg.remoteElement(),
                "ConnectionPath", msg.channel());
        } else if (v.initialValue().isPresent() && v.dims().isEmpty() && TypeTable.isElementary(v.type())) {
            var data = append(e, "Data", "Format", "Decorated");
            append(data, "DataValue",
                "DataType", TypeTable.toSource(v.type()),
                "Radix", radix(v.type()),
                "Value", value(v.type(), v.initialValue().get()));
        }
    }

    private static String tagType(IR.TAG_KIND kind) {
        return switch (kind) {
            case PRODUCED -> "Produced";
            case CONSUMED -> "Consumed";
            default -> "Base";
        };
    }

    private static String value(String type, String value) {
        if (type.equalsIgnoreCase("BOOL")) {
            if (value.equalsIgnoreCase("TRUE")) return "1";
            if (value.equalsIgnoreCase("FALSE")) return "0";
        }
        return value;
    }

    private static String radix(String type) {
        if (TypeTable.isReal(type)) return "Float";
        if (TypeTable.isElementary(type)) return "Decimal";
        return "NullType";
    }

    private static String dims(List<Integer> dims) {
        return dims.stream().map(String::valueOf).collect(Collectors.joining(" "));
    }

    // ==========================================================
    // Logic
    // ==========================================================

    private void textRoutine(Element parent, String name, List<IR.Stmt> body) {
        var routine = append(parent, "Routine", "Name", name, "Type", "ST");
        var content = append(routine, "STContent");
        var text = StPrinter.printStatements(StEmitter.statements(body), 0);
        var lines = text.isEmpty() ? List.<String>of() : List.of(text.split("\n", -1));
        int number = 0;
        for (var line : lines) {
            if (number == lines.size() - 1 && line.isEmpty()) {
                break;
            }
            appendCData(content, "Line", line, "Number", Integer.toString(number++));
        }
    }

    /** Routine names allow letters, digits and single underscores. */
    private static String routineName(String name, Set<String> taken) {
        var cleaned = name.replaceAll("[^A-Za-z0-9_]+", "_").replaceAll("_+", "_");
        if (cleaned.isEmpty() || Character.isDigit(cleaned.charAt(0))) {
            cleaned = "R_" + cleaned;
        }
        var candidate = cleaned;
        for (int n = 2; taken.contains(candidate.toLowerCase(Locale.ROOT)); n++) {
            candidate = cleaned + "_" + n;
        }
        return candidate;
    }
}
