package com.agentrelay.infrastructure.ai;

import com.agentrelay.domain.session.adapter.gateway.IAgentEventStream;
import com.agentrelay.types.enums.ResponseCode;
import com.agentrelay.types.exception.AppException;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * 基于阻塞队列的事件流：生产端由运行时回调写入，消费端由中继逐帧读取。
 */
public class QueueAgentEventStream implements IAgentEventStream {

    private final BlockingQueue<Signal> queue = new LinkedBlockingQueue<>();
    private volatile boolean closed;

    public void offer(String frame) {
        if (!closed && frame != null) {
            queue.offer(new Signal(frame, null, false));
        }
    }

    public void fail(AppException error) {
        if (!closed) {
            queue.offer(new Signal(null, error, false));
        }
    }

    public void complete() {
        if (!closed) {
            queue.offer(new Signal(null, null, true));
        }
    }

    @Override
    public String poll(long timeout, TimeUnit unit) throws InterruptedException {
        if (closed) {
            throw new AppException(ResponseCode.CAPABILITY_UNAVAILABLE, "Agent event stream is closed");
        }
        Signal signal = queue.poll(timeout, unit);
        if (signal == null) {
            return null;
        }
        if (signal.frame() != null) {
            return signal.frame();
        }
        if (signal.error() != null) {
            throw signal.error();
        }
        throw new AppException(ResponseCode.CAPABILITY_UNAVAILABLE, "Agent event stream ended before a result event");
    }

    @Override
    public void close() {
        closed = true;
        queue.clear();
    }

    public boolean isClosed() {
        return closed;
    }

    private record Signal(String frame, AppException error, boolean end) {
    }
}
