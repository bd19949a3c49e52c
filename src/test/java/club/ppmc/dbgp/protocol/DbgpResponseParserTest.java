package club.ppmc.dbgp.protocol;

import static org.assertj.core.api.Assertions.assertThat;

import club.ppmc.dbgp.model.dbgp.Breakpoint;
import club.ppmc.dbgp.model.dbgp.DbgpInitInfo;
import club.ppmc.dbgp.model.dbgp.StackFrame;
import club.ppmc.dbgp.model.dbgp.Variable;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class DbgpResponseParserTest {

    @Test
    void parsesResponseAttributes() {
        DbgpResponse response = DbgpResponseParser.parseResponse(
                "<?xml version=\"1.0\"?><response xmlns=\"urn:debugger_protocol_v1\" command=\"step_into\" "
                        + "transaction_id=\"12\" status=\"break\" reason=\"ok\"/>");

        assertThat(response.command()).isEqualTo("step_into");
        assertThat(response.transactionId()).isEqualTo("12");
        assertThat(response.status()).isEqualTo("break");
        assertThat(response.reason()).isEqualTo("ok");
    }

    @Test
    void transactionIdIsAbsentForNotifications() {
        assertThat(DbgpResponseParser.transactionId("<notify name=\"error\"/>")).isEmpty();
        assertThat(DbgpResponseParser.transactionId(null)).isEmpty();
        assertThat(DbgpResponseParser.transactionId("<response transaction_id=\"42\"/>")).hasValue(42);
    }

    @Test
    void decodesBase64PropertyValues() {
        List<Variable> variables = DbgpResponseParser.parseProperties(
                "<response command=\"context_get\" transaction_id=\"3\">"
                        + "<property name=\"greeting\" fullname=\"greeting\" type=\"string\" encoding=\"base64\">aGVsbG8=</property>"
                        + "<property name=\"count\" fullname=\"count\" type=\"integer\"><![CDATA[NDI=]]></property>"
                        + "<property name=\"empty\" fullname=\"empty\" type=\"undefined\"/>"
                        + "</response>");

        assertThat(variables).containsExactly(
                new Variable("greeting", "greeting", "string", "hello"),
                new Variable("count", "count", "integer", "42"),
                new Variable("empty", "empty", "undefined", ""));
    }

    @Test
    void keepsRawValueWhenNotBase64() {
        List<Variable> variables = DbgpResponseParser.parseProperties(
                "<response><property name=\"s\" type=\"string\">not base64!!</property>"
                        + "<property name=\"n\" type=\"string\" encoding=\"none\">YWJj</property></response>");

        assertThat(variables).extracting(Variable::value).containsExactly("not base64!!", "YWJj");
    }

    @Test
    void decodeFallsBackWhenBytesAreNotUtf8() {
        // "/w==" decodes to 0xFF which is not valid UTF-8
        assertThat(DbgpResponseParser.decodeBase64OrRaw("/w==")).isEqualTo("/w==");
        assertThat(DbgpResponseParser.decodeBase64OrRaw("abc")).isEqualTo("abc");
        assertThat(DbgpResponseParser.decodeBase64OrRaw("5L2g5aW9")).isEqualTo("你好");
    }

    @Test
    void parsesStackFramesWithIntegerFields() {
        List<StackFrame> frames = DbgpResponseParser.parseStack(
                "<response command=\"stack_get\" transaction_id=\"4\">"
                        + "<stack level=\"0\" type=\"file\" filename=\"file:///C:/a.ahk\" lineno=\"12\" where=\"Compute\"/>"
                        + "<stack level=\"1\" type=\"file\" filename=\"file:///C:/a.ahk\" lineno=\"3\" where=\"\"></stack>"
                        + "</response>");

        assertThat(frames).containsExactly(
                new StackFrame(0, "file", "file:///C:/a.ahk", 12, "Compute"),
                new StackFrame(1, "file", "file:///C:/a.ahk", 3, ""));
    }

    @Test
    void parsesBreakpointsAndStripsFileScheme() {
        List<Breakpoint> breakpoints = DbgpResponseParser.parseBreakpoints(
                "<response command=\"breakpoint_list\" transaction_id=\"5\">"
                        + "<breakpoint id=\"1\" type=\"line\" state=\"enabled\" filename=\"file:///C:/scripts/a.ahk\" lineno=\"10\"/>"
                        + "<breakpoint id=\"2\" type=\"line\" state=\"disabled\" filename=\"file:///home/me/b.ahk\" lineno=\"4\">"
                        + "<expression>eCA+IDU=</expression></breakpoint>"
                        + "<breakpoint id=\"3\" type=\"exception\" state=\"enabled\"/>"
                        + "</response>");

        assertThat(breakpoints).containsExactly(
                new Breakpoint("1", "C:/scripts/a.ahk", 10, null, "enabled"),
                new Breakpoint("2", "/home/me/b.ahk", 4, "x > 5", "disabled"));
    }

    @Test
    void emptyInputsYieldEmptyResults() {
        assertThat(DbgpResponseParser.parseProperties("")).isEmpty();
        assertThat(DbgpResponseParser.parseStack(null)).isEmpty();
        assertThat(DbgpResponseParser.parseBreakpoints("<response/>")).isEmpty();
        assertThat(DbgpResponseParser.parseEngineError("")).isEmpty();
        assertThat(DbgpResponseParser.parseFault(null)).isEmpty();
        assertThat(DbgpResponseParser.parseResponse(null).attributes()).isEmpty();
    }

    @Test
    void extractsEngineError() {
        Optional<DbgpResponseParser.EngineError> error = DbgpResponseParser.parseEngineError(
                "<response command=\"breakpoint_remove\" transaction_id=\"6\">"
                        + "<error code=\"205\"><message><![CDATA[no such breakpoint]]></message></error></response>");

        assertThat(error).contains(new DbgpResponseParser.EngineError("205", "no such breakpoint"));
    }

    @Test
    void extractsFaultFromBreakResponse() {
        Optional<FaultNotice> fault = DbgpResponseParser.parseFault(
                "<response command=\"run\" transaction_id=\"7\" status=\"break\" reason=\"error\">"
                        + "<xdebug:message filename=\"file:///C:/scripts/a.ahk\" lineno=\"8\" exception=\"TypeError\">"
                        + "<![CDATA[Expected a Number]]></xdebug:message></response>");

        assertThat(fault).contains(new FaultNotice("C:/scripts/a.ahk", 8, "TypeError", "Expected a Number"));
    }

    @Test
    void faultWithoutExceptionAttributeDefaultsToError() {
        Optional<FaultNotice> fault = DbgpResponseParser.parseFault(
                "<notify name=\"error\"><xdebug:message filename=\"file:///C:/a.ahk\" lineno=\"2\" "
                        + "encoding=\"base64\">Ym9vbQ==</xdebug:message></notify>");

        assertThat(fault).contains(new FaultNotice("C:/a.ahk", 2, "Error", "boom"));
    }

    @Test
    void parsesInitHandshake() {
        DbgpInitInfo info = DbgpResponseParser.parseInit(
                "<init appid=\"AutoHotkey\" idekey=\"\" thread=\"7904\" language=\"AutoHotkey\" "
                        + "protocol_version=\"1.0\" fileuri=\"file:///C:/scripts/a%20b.ahk\"/>");

        assertThat(info).isEqualTo(new DbgpInitInfo("C:/scripts/a b.ahk", "AutoHotkey", "1.0", "AutoHotkey", "", "7904"));
    }

    @Test
    void convertsBetweenPathsAndFileUris() {
        assertThat(DbgpResponseParser.pathToFileUri("C:\\scripts\\a.ahk")).isEqualTo("file:///C:/scripts/a.ahk");
        assertThat(DbgpResponseParser.pathToFileUri("/home/me/a.ahk")).isEqualTo("file:///home/me/a.ahk");
        assertThat(DbgpResponseParser.fileUriToPath("file:///C:/scripts/a.ahk")).isEqualTo("C:/scripts/a.ahk");
        assertThat(DbgpResponseParser.fileUriToPath("file:///home/me/a.ahk")).isEqualTo("/home/me/a.ahk");
        assertThat(DbgpResponseParser.fileUriToPath("C:/plain.ahk")).isEqualTo("C:/plain.ahk");
    }

    @Test
    void percentEncodesReservedCharactersInFileUris() {
        String uri = DbgpResponseParser.pathToFileUri("C:\\My Scripts\\50%.ahk");

        assertThat(uri).isEqualTo("file:///C:/My%20Scripts/50%25.ahk");
        assertThat(DbgpResponseParser.fileUriToPath(uri)).isEqualTo("C:/My Scripts/50%.ahk");
        assertThat(DbgpResponseParser.fileUriToPath("file:///C:/bad%zz.ahk")).isEqualTo("C:/bad%zz.ahk");
    }

    @Test
    void unescapesAttributeEntities() {
        assertThat(DbgpResponseParser.parseAttributes(" where=\"a &lt; b &amp;&amp; c\" level=\"0\""))
                .containsEntry("where", "a < b && c")
                .containsEntry("level", "0");
    }
}
