package com.redfox.core.http;

import com.redfox.core.api.ITransceiver;
import com.redfox.core.model.ExchangeResult;
import com.redfox.core.model.FailureKind;
import com.redfox.core.model.RawResponse;
import com.redfox.core.model.RequestContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.SocketFactory;
import javax.net.ssl.SSLException;
import javax.net.ssl.SSLSocket;
import javax.net.ssl.SSLSocketFactory;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.ConnectException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Objects;

/**
 * 소켓 하나의 수명(connect → TLS → send → EOF 까지 receive → close)을 한 번의 호출 안에서 관리한다.
 * <ul>
 *   <li>호출마다 새 소켓, 풀링/재사용 없음. 소켓과 버퍼는 모두 메서드 지역 상태</li>
 *   <li>응답 길이는 보지 않는다. 상대가 연결을 닫을 때까지 1024 바이트씩 읽는다</li>
 *   <li>연결 계층 오류는 던지지 않고 {@link ExchangeResult.Failure} 로 돌려준다. 재시도 없음</li>
 *   <li>디코드 실패는 소프트 실패: 경고만 남기고 원본 바이트를 돌려준다</li>
 * </ul>
 */
public class Transceiver implements ITransceiver {

    private static final Logger LOG = LoggerFactory.getLogger(Transceiver.class);

    static final int CHUNK_SIZE = 1024;

    private final SocketFactory socketFactory;
    private final SSLSocketFactory tlsFactory;

    /** 시스템 기본 소켓 + JVM 기본 trust store 를 쓰는 TLS */
    public Transceiver() {
        this(SocketFactory.getDefault(), (SSLSocketFactory) SSLSocketFactory.getDefault());
    }

    /** 테스트용: 자체 서명 인증서를 신뢰하는 팩토리 등을 주입 */
    public Transceiver(SocketFactory socketFactory, SSLSocketFactory tlsFactory) {
        this.socketFactory = Objects.requireNonNull(socketFactory, "socketFactory");
        this.tlsFactory = Objects.requireNonNull(tlsFactory, "tlsFactory");
    }

    /** ctx 에 마지막으로 빌드된 요청을 보낸다. 아직 빌드 전이면 기본 GET 을 만든다. */
    @Override
    public ExchangeResult execute(RequestContext ctx, int timeoutSeconds, String encoding, boolean decode) {
        Objects.requireNonNull(ctx, "ctx");
        String request = ctx.lastRequest();
        if (request == null) request = RequestBuilder.build(ctx);
        return execute(ctx, request, timeoutSeconds, encoding, decode);
    }

    /**
     * 명시한 요청 문자열을 그대로 보낸다.
     *
     * @throws IllegalArgumentException encoding 이 지원되지 않는 charset 이거나 요청을 그 charset 으로
     *                                  표현할 수 없을 때(소켓을 열기 전에 판정)
     */
    public ExchangeResult execute(RequestContext ctx, String request, int timeoutSeconds,
                                  String encoding, boolean decode) {
        Objects.requireNonNull(ctx, "ctx");
        Objects.requireNonNull(request, "request");
        final Charset charset = charsetOf(encoding);
        final byte[] payload = strictEncode(request, charset);
        final int timeoutMs = timeoutMillis(timeoutSeconds);
        final long start = System.nanoTime();

        byte[] data;
        try {
            data = exchange(ctx, payload, timeoutMs);
        } catch (UnknownHostException e) {
            return fail(ctx, FailureKind.NAME_RESOLUTION, e);
        } catch (ConnectException e) {
            return fail(ctx, FailureKind.CONNECTION_REFUSED, e);
        } catch (SocketTimeoutException e) {
            return fail(ctx, FailureKind.TIMEOUT, e);
        } catch (SSLException e) {
            return fail(ctx, FailureKind.TLS_HANDSHAKE, e);
        } catch (IOException e) {
            return fail(ctx, FailureKind.IO_ERROR, e);
        }

        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        LOG.debug("exchange done host={} port={} tls={} bytes={} elapsedMs={}",
                ctx.getHost(), ctx.getPort(), ctx.useTls(), data.length, elapsedMs);

        if (!decode) {
            return new ExchangeResult.Success(new RawResponse.Bytes(data), elapsedMs, data.length, null);
        }
        try {
            String text = strictDecode(data, charset);
            return new ExchangeResult.Success(new RawResponse.Text(text, charset), elapsedMs, data.length, null);
        } catch (CharacterCodingException e) {
            String reason = "response is not valid " + charset.name() + ": " + e;
            LOG.warn("could not decode response from {} ({} bytes): {}", ctx.getHost(), data.length, reason);
            return new ExchangeResult.Success(new RawResponse.Bytes(data), elapsedMs, data.length, reason);
        }
    }

    private byte[] exchange(RequestContext ctx, byte[] payload, int timeoutMs) throws IOException {
        InetSocketAddress address = new InetSocketAddress(ctx.getHost(), ctx.getPort());
        if (address.isUnresolved()) {
            throw new UnknownHostException(ctx.getHost());
        }
        try (Socket raw = socketFactory.createSocket()) {
            if (timeoutMs > 0) raw.setSoTimeout(timeoutMs);
            raw.connect(address, timeoutMs);

            // TLS 는 연결된 소켓 위에 얹는다(autoClose=true, SNI 는 host 이름 기본값)
            try (Socket socket = ctx.useTls() ? handshake(raw, ctx, timeoutMs) : raw) {
                OutputStream out = socket.getOutputStream();
                out.write(payload);
                out.flush();

                InputStream in = socket.getInputStream();
                ByteArrayOutputStream received = new ByteArrayOutputStream(CHUNK_SIZE * 4);
                byte[] chunk = new byte[CHUNK_SIZE];
                int n;
                while ((n = in.read(chunk)) != -1) {
                    received.write(chunk, 0, n);
                }
                return received.toByteArray();
            }
        }
    }

    private SSLSocket handshake(Socket raw, RequestContext ctx, int timeoutMs) throws IOException {
        SSLSocket tls = (SSLSocket) tlsFactory.createSocket(raw, ctx.getHost(), ctx.getPort(), true);
        if (timeoutMs > 0) tls.setSoTimeout(timeoutMs);
        tls.startHandshake();
        return tls;
    }

    private static ExchangeResult fail(RequestContext ctx, FailureKind kind, IOException e) {
        LOG.warn("could not exchange with {}:{} kind={} error={}",
                ctx.getHost(), ctx.getPort(), kind, e.toString());
        return new ExchangeResult.Failure(kind, String.valueOf(e.getMessage()));
    }

    /** 치환 없이 인코딩. 표현할 수 없는 문자가 있으면 소켓을 열기 전에 호출자 오류 */
    static byte[] strictEncode(String request, Charset charset) {
        try {
            ByteBuffer buf = charset.newEncoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .encode(CharBuffer.wrap(request));
            byte[] out = new byte[buf.remaining()];
            buf.get(out);
            return out;
        } catch (CharacterCodingException e) {
            throw new IllegalArgumentException("request cannot be encoded as " + charset.name() + ": " + e, e);
        } catch (UnsupportedOperationException e) {
            // 디코드 전용 charset
            throw new IllegalArgumentException("charset cannot encode: " + charset.name(), e);
        }
    }

    /** 0 이하 = 무기한. int 범위를 넘으면 Integer.MAX_VALUE 로 자른다. */
    static int timeoutMillis(int timeoutSeconds) {
        if (timeoutSeconds <= 0) return 0;
        return (int) Math.min(timeoutSeconds * 1000L, Integer.MAX_VALUE);
    }

    private static String strictDecode(byte[] data, Charset charset) throws CharacterCodingException {
        return charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(data))
                .toString();
    }

    static Charset charsetOf(String encoding) {
        String name = (encoding == null || encoding.isBlank()) ? DEFAULT_ENCODING : encoding.trim();
        try {
            return Charset.forName(name);
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            throw new IllegalArgumentException("unsupported encoding: " + name, e);
        }
    }
}
