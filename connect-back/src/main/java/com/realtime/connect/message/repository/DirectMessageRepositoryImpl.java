package com.realtime.connect.message.repository;

import com.realtime.connect.common.PairKey;
import com.realtime.connect.message.entity.DirectMessage;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;

import java.util.List;

class DirectMessageRepositoryImpl implements DirectMessageRepositoryCustom {

    @PersistenceContext
    private EntityManager em;

    @Override
    public List<DirectMessage> findNewestFirst(PairKey pair, int offset, int limit) {
        // PageRequest는 offset이 limit의 배수여야 해서 직접 지정
        return em.createQuery("""
                        select m from DirectMessage m
                        where m.pairLow = :low and m.pairHigh = :high
                        order by m.createdAt desc, m.id desc
                        """, DirectMessage.class)
                .setParameter("low", pair.low())
                .setParameter("high", pair.high())
                .setFirstResult(offset)
                .setMaxResults(limit)
                .getResultList();
    }
}
