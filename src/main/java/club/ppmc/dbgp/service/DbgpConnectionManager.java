/**
 * DbgpConnectionManager.java
 *
 * 持有监听套接字和唯一的活动调试引擎连接。
 * 监听只绑定回环地址；端口被占用时依次尝试下一个端口，直到达到配置的最大尝试次数。
 * 接受线程一次只处理一个连接：读取循环结束（引擎断开或出错）后才会接受下一个连接。
 * 收到的字节经 DbgpFrameDecoder 切分后转交给 DbgpConnectionListener。
 */
package club.ppmc.dbgp.service;

import club.ppmc.dbgp.exception.DbgpErrorType;
import club.ppmc.dbgp.exception.DbgpException;
import club.ppmc.dbgp.model.dbgp.ConnectionState;
import club.ppmc.dbgp.protocol.DbgpFrame;
import club.ppmc.dbgp.protocol.DbgpFrameDecoder;
import club.ppmc.dbgp.protocol.DbgpTransport;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.BindException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class DbgpConnectionManager implements DbgpTransport {

    private static final int MAX_PORT = 65535;

    private final DbgpConnectionListener listener;
    private final int maxPortAttempts;
    private final Object writeLock = new Object();

    private volatile ServerSocket serverSocket;
    private volatile Socket socket;
    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private volatile int port;
    private volatile Thread acceptThread;

    public DbgpConnectionManager(DbgpConnectionListener listener, int maxPortAttempts) {
        this.listener = listener;
        this.maxPortAttempts = Math.max(1, maxPortAttempts);
    }

    /**
     * 在回环地址上开始监听。已在监听时直接返回当前端口。
     *
     * @param requestedPort 首选端口，0 表示由系统分配。
     * @return 实际监听的端口。
     * @throws DbgpException 端口全部被占用时为 NO_AVAILABLE_PORT，其他绑定错误为 TRANSPORT。
     */
    public synchronized int listen(int requestedPort) {
        if (serverSocket != null && !serverSocket.isClosed()) {
            return port;
        }

        int candidate = requestedPort;
        for (int attempt = 1; attempt <= maxPortAttempts && candidate <= MAX_PORT; attempt++, candidate++) {
            ServerSocket server = null;
            try {
                server = new ServerSocket();
                server.bind(new InetSocketAddress(InetAddress.getLoopbackAddress(), candidate));
            } catch (BindException e) {
                closeQuietly(server);
                log.warn("端口 {} 已被占用，尝试下一个端口 (第 {}/{} 次)", candidate, attempt, maxPortAttempts);
                continue;
            } catch (IOException e) {
                closeQuietly(server);
                throw new DbgpException(DbgpErrorType.TRANSPORT, "无法在端口 " + candidate + " 上监听: " + e.getMessage(), e);
            }
            startAccepting(server);
            return port;
        }
        throw new DbgpException(
                DbgpErrorType.NO_AVAILABLE_PORT,
                String.format("从端口 %d 起尝试了 %d 个端口，均不可用", requestedPort, maxPortAttempts));
    }

    private void startAccepting(ServerSocket server) {
        this.serverSocket = server;
        this.port = server.getLocalPort();
        this.state = ConnectionState.LISTENING;
        log.info("DBGp 监听已启动: {}:{}", server.getInetAddress().getHostAddress(), port);
        listener.onListening(port);

        Thread thread = new Thread(() -> acceptLoop(server), "DBGp-Accept-" + port);
        thread.setDaemon(true);
        this.acceptThread = thread;
        thread.start();
    }

    private void acceptLoop(ServerSocket server) {
        while (!server.isClosed()) {
            Socket accepted;
            try {
                accepted = server.accept();
            } catch (IOException e) {
                if (!server.isClosed()) {
                    log.error("接受调试连接失败: {}", e.getMessage(), e);
                }
                break;
            }
            handleConnection(server, accepted);
        }
        log.debug("端口 {} 的接受线程已退出。", server.getLocalPort());
    }

    private void handleConnection(ServerSocket server, Socket accepted) {
        String remote = accepted.getRemoteSocketAddress().toString();
        this.socket = accepted;
        this.state = ConnectionState.CONNECTED;
        log.info("调试引擎已连接: {}", remote);
        safely(() -> listener.onConnected(remote));

        var decoder = new DbgpFrameDecoder();
        try (accepted; InputStream in = accepted.getInputStream()) {
            byte[] chunk = new byte[8192];
            int read;
            while ((read = in.read(chunk)) != -1) {
                for (DbgpFrame frame : decoder.feed(chunk, 0, read)) {
                    dispatch(frame);
                }
            }
        } catch (IOException e) {
            if (!accepted.isClosed() && !server.isClosed()) {
                log.error("调试连接出错 ({}): {}", remote, e.getMessage());
            }
        } finally {
            synchronized (writeLock) {
                if (this.socket == accepted) {
                    this.socket = null;
                }
            }
            this.state = server.isClosed() ? ConnectionState.DISCONNECTED : ConnectionState.LISTENING;
            log.info("调试引擎已断开: {}", remote);
            safely(listener::onDisconnected);
        }
    }

    private void dispatch(DbgpFrame frame) {
        if (frame.kind() == DbgpFrame.Kind.INIT) {
            safely(() -> listener.onInit(frame.payload()));
        } else {
            safely(() -> listener.onMessage(frame.payload()));
        }
    }

    // 回调异常不能中断读取循环
    private void safely(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.error("处理调试事件时出错: {}", e.getMessage(), e);
        }
    }

    @Override
    public boolean isOpen() {
        Socket current = socket;
        return current != null && !current.isClosed();
    }

    @Override
    public void write(byte[] bytes) throws IOException {
        synchronized (writeLock) {
            Socket current = socket;
            if (current == null || current.isClosed()) {
                throw new IOException("没有活动的调试连接");
            }
            OutputStream out = current.getOutputStream();
            out.write(bytes);
            out.flush();
        }
    }

    /**
     * 关闭活动连接和监听套接字。可以重复调用。
     */
    public synchronized void close() {
        Socket current = socket;
        if (current != null) {
            closeQuietly(current);
        }
        ServerSocket server = serverSocket;
        if (server != null) {
            closeQuietly(server);
            serverSocket = null;
            log.info("DBGp 监听已关闭 (端口 {})。", port);
        }
        Thread thread = acceptThread;
        if (thread != null && thread != Thread.currentThread()) {
            try {
                thread.join(1000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            acceptThread = null;
        }
        state = ConnectionState.DISCONNECTED;
    }

    public ConnectionState getState() {
        return state;
    }

    public boolean isConnected() {
        return state == ConnectionState.CONNECTED && isOpen();
    }

    public int getPort() {
        return port;
    }

    private static void closeQuietly(AutoCloseable closeable) {
        if (closeable == null) {
            return;
        }
        try {
            closeable.close();
        } catch (Exception e) {
            log.debug("关闭套接字时出错: {}", e.getMessage());
        }
    }
}
