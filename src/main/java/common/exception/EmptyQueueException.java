package common.exception;

import common.consts.ErrorCodes;

/**
 * 从空事件队列中取事件
 */
public class EmptyQueueException extends BusinessException {

    public EmptyQueueException() {
        super(ErrorCodes.EVENT_QUEUE_EMPTY);
    }
}
