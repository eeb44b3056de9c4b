package com.yerin.flowq.application;

import com.yerin.flowq.domain.BrokerJob;

public interface FlowJobHandler {

    /** 처리할 큐 이름 */
    String queue();

    /**
     * @return 실행된 태스크 수. 실패하면 예외를 던진다.
     */
    int handle(BrokerJob job);
}
