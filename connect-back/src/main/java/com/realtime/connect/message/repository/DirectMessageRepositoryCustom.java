package com.realtime.connect.message.repository;

import com.realtime.connect.common.PairKey;
import com.realtime.connect.message.entity.DirectMessage;

import java.util.List;

public interface DirectMessageRepositoryCustom {

    /** 최신순(created_at desc, id desc)으로 offset개 건너뛰고 limit개 */
    List<DirectMessage> findNewestFirst(PairKey pair, int offset, int limit);
}
