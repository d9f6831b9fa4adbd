package org.muma.mini.kv.server;

/**
 * 命令执行上下文
 * 保存命令可能需要读取或修改的连接级状态
 */
public class RedisContext {

    private final String clientAddress;
    private boolean closeRequested;

    public RedisContext(String clientAddress) {
        this.clientAddress = clientAddress;
    }

    public String getClientAddress() {
        return clientAddress;
    }

    /**
     * 当前回复写出后关闭连接
     */
    public void requestClose() {
        this.closeRequested = true;
    }

    public boolean isCloseRequested() {
        return closeRequested;
    }
}
