package org.splice.syntax;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

final class PrinterTest {

    private static final String SAMPLE = String.join("\n",
            "#[derive(Clone)]",
            "pub struct Point {",
            "    pub x: i32,",
            "    y: i32,",
            "}",
            "const LIMIT: usize = 10;",
            "static mut COUNTER: u32 = 0;",
            "type Pair = (i32, i32);",
            "extern \"C\" {",
            "    fn abs(x: i32) -> i32;",
            "}",
            "mod util {",
            "    pub(crate) fn twice(x: i32) -> i32 { x * 2 }",
            "}",
            "pub unsafe extern \"C\" fn run(p: *mut Point, n: &mut i32) -> i32 {",
            "    let mut total = 0;",
            "    let (a, _) = (1, 2);",
            "    while total < LIMIT as i32 {",
            "        total = total + util::twice(a) - -1;",
            "        *n = (*p).x;",
            "    }",
            "    if total > 3 && !done(&total) {",
            "        return total;",
            "    } else if total == 0 {",
            "        total = 1;",
            "    } else {",
            "        unsafe { COUNTER = COUNTER + 1; }",
            "    }",
            "    let q = Point { x: 1, y: total };",
            "    q.x.pow(2) + v[0] as i32",
            "}",
            "");

    private final Session session = new Session();

    private String reprint(String expr) {
        return Printer.print(session.parse(NodeKind.EXPR, expr));
    }

    @Test
    void printedTextParsesToTheSameStructure() {
        Node crate = session.parseCrate("sample.rs", SAMPLE);
        String printed = Printer.print(crate);
        Node reparsed = session.parseCrate("printed.rs", printed);
        assertTrue(reparsed.sameStructure(crate), printed);
        assertEquals(printed, Printer.print(reparsed), "printing is a fixpoint");
    }

    @Test
    void itemsAndBlocksAreLaidOut() {
        Node crate = session.parseCrate("lib.rs", "fn f(){let x=1;}\nstruct S{a:i32}\nmod m{}");
        assertEquals("fn f() {\n    let x = 1;\n}\n\nstruct S {\n    a: i32,\n}\n\nmod m {}\n",
                Printer.print(crate));
    }

    @Test
    void parenthesesComeFromPrecedence() {
        assertEquals("(a + b) * c", reprint("(a + b) * c"));
        assertEquals("a - b - c", reprint("((a - b)) - c"));
        assertEquals("a - (b - c)", reprint("a - (b - c)"));
        assertEquals("(*p).x", reprint("(*p).x"));
        assertEquals("-a as u8", reprint("(-a) as u8"));
        assertEquals("(a.f)()", reprint("(a.f)()"), "field callee is not a method call");
        assertEquals("a.f()", reprint("a.f()"));
    }

    @Test
    void structLiteralInConditionIsWrapped() {
        assertEquals("if (S { a: 1 }.a) {}", reprint("if (S { a: 1 }).a {}"));
        assertEquals("if s {} else {}", reprint("if s {} else {}"));
    }

    @Test
    void statementStartingWithBlockIsWrapped() {
        Node expr = session.parse(NodeKind.EXPR, "{ 1 } + 2");
        Node stmt = new Node(Variant.STMT_SEMI, Node.DUMMY_ID, Span.DUMMY, expr);
        String printed = Printer.print(stmt);
        assertEquals("({\n    1\n} + 2);", printed);
        assertTrue(session.parse(NodeKind.STMT, printed).sameStructure(stmt));
    }

    @Test
    void tuplesKeepTheirCommas() {
        assertEquals("(a,)", reprint("(a,)"));
        assertEquals("()", reprint("()"));
        assertEquals("(a, b)", reprint("(a, b,)"));
        assertEquals("S {}", reprint("S {}"));
    }

    @Test
    void baseIndentPrefixesEveryFollowingLine() {
        Node block = session.parse(NodeKind.EXPR, "{ a; }");
        assertEquals("{\n        a;\n    }", Printer.print(block, "    "));
    }

    @Test
    void attributesAndQualifiersArePrinted() {
        Node item = session.parse(NodeKind.ITEM, "#[cfg(test)] pub const unsafe extern fn f() {}");
        assertEquals("#[cfg(test)]\npub const unsafe extern fn f() {}", Printer.print(item));
    }
}
