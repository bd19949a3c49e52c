/**
 * DbgpTransport.java
 *
 * TransactionRouter 写出命令所依赖的底层通道，由 DbgpConnectionManager 实现。
 */
package club.ppmc.dbgp.protocol;

import java.io.IOException;

public interface DbgpTransport {

    /** 当前是否有可写的引擎连接。 */
    boolean isOpen();

    /**
     * 写出一条已编码的命令。实现必须保证并发调用时每条命令完整写出、互不交错。
     */
    void write(byte[] bytes) throws IOException;
}
