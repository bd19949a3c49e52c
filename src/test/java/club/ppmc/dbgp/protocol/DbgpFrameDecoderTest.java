package club.ppmc.dbgp.protocol;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class DbgpFrameDecoderTest {

    private static final String INIT =
            "<?xml version=\"1.0\" encoding=\"UTF-8\"?><init appid=\"AutoHotkey\" language=\"AutoHotkey\" "
                    + "protocol_version=\"1.0\" fileuri=\"file:///C:/scripts/a.ahk\"/>";
    private static final String RESPONSE =
            "<response command=\"run\" transaction_id=\"1\" status=\"break\" reason=\"ok\"/>";

    @Test
    void dropsLengthHeadersAndClassifiesFrames() {
        var decoder = new DbgpFrameDecoder();

        List<DbgpFrame> frames = decoder.feed(wire(INIT, RESPONSE));

        assertThat(frames).extracting(DbgpFrame::kind)
                .containsExactly(DbgpFrame.Kind.INIT, DbgpFrame.Kind.MESSAGE);
        assertThat(frames.get(0).payload()).isEqualTo(INIT);
        assertThat(frames.get(1).payload()).isEqualTo(RESPONSE);
        assertThat(decoder.pendingBytes()).isZero();
    }

    @Test
    void keepsIncompleteFrameUntilTerminatorArrives() {
        var decoder = new DbgpFrameDecoder();
        byte[] bytes = wire(RESPONSE);
        int cut = bytes.length - 10;

        List<DbgpFrame> first = decoder.feed(bytes, 0, cut);
        assertThat(first).isEmpty();
        assertThat(decoder.pendingBytes()).isEqualTo(cut - headerLength(RESPONSE));

        List<DbgpFrame> second = decoder.feed(bytes, cut, bytes.length - cut);
        assertThat(second).extracting(DbgpFrame::payload).containsExactly(RESPONSE);
    }

    @Test
    void splittingTheStreamAnywhereYieldsTheSameFrames() {
        byte[] bytes = wire(INIT, RESPONSE, "<response command=\"eval\" transaction_id=\"2\"/>");
        List<String> expected = payloads(new DbgpFrameDecoder().feed(bytes));

        for (int cut = 0; cut <= bytes.length; cut++) {
            var decoder = new DbgpFrameDecoder();
            List<DbgpFrame> frames = new ArrayList<>(decoder.feed(bytes, 0, cut));
            frames.addAll(decoder.feed(bytes, cut, bytes.length - cut));
            assertThat(payloads(frames)).as("split at %d", cut).isEqualTo(expected);
        }
    }

    @Test
    void feedingOneByteAtATimeDecodesMultiByteCharacters() {
        String message = "<response command=\"eval\" transaction_id=\"3\"><property name=\"变量\"/></response>";
        byte[] bytes = wire(message);
        var decoder = new DbgpFrameDecoder();

        List<DbgpFrame> frames = new ArrayList<>();
        for (int i = 0; i < bytes.length; i++) {
            frames.addAll(decoder.feed(bytes, i, 1));
        }

        assertThat(frames).extracting(DbgpFrame::payload).containsExactly(message);
    }

    @Test
    void ignoresBlankFrames() {
        var decoder = new DbgpFrameDecoder();

        List<DbgpFrame> frames = decoder.feed("\0  \0".getBytes(StandardCharsets.UTF_8));

        assertThat(frames).isEmpty();
        assertThat(decoder.pendingBytes()).isZero();
    }

    @Test
    void growsBufferForLargeMessages() {
        String value = "x".repeat(20_000);
        String message = "<response command=\"eval\" transaction_id=\"4\"><property>" + value + "</property></response>";

        List<DbgpFrame> frames = new DbgpFrameDecoder().feed(wire(message));

        assertThat(frames).hasSize(1);
        assertThat(frames.get(0).payload()).isEqualTo(message);
    }

    private static byte[] wire(String... messages) {
        var out = new ByteArrayOutputStream();
        for (String message : messages) {
            byte[] payload = message.getBytes(StandardCharsets.UTF_8);
            out.writeBytes(String.valueOf(payload.length).getBytes(StandardCharsets.US_ASCII));
            out.write(0);
            out.writeBytes(payload);
            out.write(0);
        }
        return out.toByteArray();
    }

    private static int headerLength(String message) {
        return String.valueOf(message.getBytes(StandardCharsets.UTF_8).length).length() + 1;
    }

    private static List<String> payloads(List<DbgpFrame> frames) {
        return frames.stream().map(DbgpFrame::payload).toList();
    }
}
