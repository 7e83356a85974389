package com.barmm.ledger.mapper;

import com.barmm.ledger.mapper.model.ChainCheckpointRow;
import com.barmm.ledger.mapper.model.ChainRecordRow;
import com.barmm.ledger.mapper.model.GroupCountRow;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.time.Instant;
import java.util.List;

@Mapper
public interface ChainRecordMapper {

    String COLUMNS = "id, kind, scope_id, seq, unique_key, action, entity_type, entity_id, "
            + "payload_json, actor_id, created_at, prev_hash, record_hash";

    String AUDIT_FILTER = "<where>"
            + " kind = 'AUDIT'"
            + " <if test='actorId != null'> AND actor_id = #{actorId}</if>"
            + " <if test='action != null'> AND action = #{action}</if>"
            + " <if test='entityType != null'> AND entity_type = #{entityType}</if>"
            + " <if test='entityId != null'> AND entity_id = #{entityId}</if>"
            + " <if test='from != null'> AND created_at &gt;= #{from}</if>"
            + " <if test='to != null'> AND created_at &lt;= #{to}</if>"
            + " <if test='pattern != null'> AND (LOWER(action) LIKE #{pattern} ESCAPE '\\'"
            + " OR LOWER(entity_type) LIKE #{pattern} ESCAPE '\\')</if>"
            + "</where>";

    /** 链尾（seq 最大的一条） */
    @Select("SELECT " + COLUMNS + " FROM chain_records"
            + " WHERE kind = #{kind} AND scope_id = #{scopeId} ORDER BY seq DESC LIMIT 1")
    ChainRecordRow selectLatest(@Param("kind") String kind, @Param("scopeId") String scopeId);

    /** 整条链，按 seq 升序 */
    @Select("SELECT " + COLUMNS + " FROM chain_records"
            + " WHERE kind = #{kind} AND scope_id = #{scopeId} ORDER BY seq ASC")
    List<ChainRecordRow> selectTimeline(@Param("kind") String kind, @Param("scopeId") String scopeId);

    @Select("SELECT " + COLUMNS + " FROM chain_records WHERE kind = #{kind} AND id = #{id}")
    ChainRecordRow selectById(@Param("kind") String kind, @Param("id") String id);

    @Select("SELECT COUNT(*) FROM chain_records WHERE kind = #{kind} AND scope_id = #{scopeId}")
    long countByScope(@Param("kind") String kind, @Param("scopeId") String scopeId);

    @Select("SELECT COUNT(*) FROM chain_records"
            + " WHERE kind = #{kind} AND scope_id = #{scopeId} AND unique_key = #{uniqueKey}")
    int countByUniqueKey(@Param("kind") String kind,
                         @Param("scopeId") String scopeId,
                         @Param("uniqueKey") String uniqueKey);

    @Insert("INSERT INTO chain_records (" + COLUMNS + ") VALUES ("
            + "#{row.id}, #{row.kind}, #{row.scopeId}, #{row.seq}, #{row.uniqueKey}, #{row.action},"
            + " #{row.entityType}, #{row.entityId}, #{row.payloadJson}, #{row.actorId}, #{row.createdAt},"
            + " #{row.prevHash}, #{row.recordHash})")
    int insert(@Param("row") ChainRecordRow row);

    @Select("<script>SELECT " + COLUMNS + " FROM chain_records " + AUDIT_FILTER
            + " ORDER BY seq DESC LIMIT #{limit} OFFSET #{offset}</script>")
    List<ChainRecordRow> selectAuditPage(@Param("actorId") String actorId,
                                         @Param("action") String action,
                                         @Param("entityType") String entityType,
                                         @Param("entityId") String entityId,
                                         @Param("from") Instant from,
                                         @Param("to") Instant to,
                                         @Param("pattern") String pattern,
                                         @Param("limit") int limit,
                                         @Param("offset") int offset);

    @Select("<script>SELECT COUNT(*) FROM chain_records " + AUDIT_FILTER + "</script>")
    long countAuditPage(@Param("actorId") String actorId,
                        @Param("action") String action,
                        @Param("entityType") String entityType,
                        @Param("entityId") String entityId,
                        @Param("from") Instant from,
                        @Param("to") Instant to,
                        @Param("pattern") String pattern);

    /** column 只接受 AuditDimension 里的固定列名 */
    @Select("<script>SELECT ${column} AS group_key, COUNT(*) AS total FROM chain_records"
            + " WHERE kind = 'AUDIT' AND ${column} IS NOT NULL"
            + " <if test='from != null'> AND created_at &gt;= #{from}</if>"
            + " <if test='to != null'> AND created_at &lt;= #{to}</if>"
            + " GROUP BY ${column}</script>")
    List<GroupCountRow> countAuditGrouped(@Param("column") String column,
                                          @Param("from") Instant from,
                                          @Param("to") Instant to);

    @Select("SELECT " + COLUMNS + " FROM chain_records"
            + " WHERE kind = 'AUDIT' AND entity_type = #{entityType} AND entity_id = #{entityId}"
            + " ORDER BY seq ASC")
    List<ChainRecordRow> selectEntityHistory(@Param("entityType") String entityType,
                                             @Param("entityId") String entityId);

    @Select("<script>SELECT created_at FROM chain_records WHERE kind = 'AUDIT'"
            + " <if test='from != null'> AND created_at &gt;= #{from}</if>"
            + " <if test='to != null'> AND created_at &lt;= #{to}</if>"
            + " ORDER BY created_at ASC</script>")
    List<Instant> selectAuditTimestamps(@Param("from") Instant from, @Param("to") Instant to);

    /** 待清理前缀中的最后一条 */
    @Select("SELECT " + COLUMNS + " FROM chain_records"
            + " WHERE kind = #{kind} AND scope_id = #{scopeId} AND created_at < #{cutoff}"
            + " ORDER BY seq DESC LIMIT 1")
    ChainRecordRow selectLastBefore(@Param("kind") String kind,
                                    @Param("scopeId") String scopeId,
                                    @Param("cutoff") Instant cutoff);

    @Delete("DELETE FROM chain_records WHERE kind = #{kind} AND scope_id = #{scopeId} AND seq <= #{maxSeq}")
    int deleteUpTo(@Param("kind") String kind, @Param("scopeId") String scopeId, @Param("maxSeq") long maxSeq);

    @Select("SELECT kind, scope_id, anchor_seq, anchor_hash, purged_count, purged_at FROM chain_checkpoints"
            + " WHERE kind = #{kind} AND scope_id = #{scopeId}")
    ChainCheckpointRow selectCheckpoint(@Param("kind") String kind, @Param("scopeId") String scopeId);

    @Insert("INSERT INTO chain_checkpoints (kind, scope_id, anchor_seq, anchor_hash, purged_count, purged_at)"
            + " VALUES (#{cp.kind}, #{cp.scopeId}, #{cp.anchorSeq}, #{cp.anchorHash}, #{cp.purgedCount}, #{cp.purgedAt})")
    int insertCheckpoint(@Param("cp") ChainCheckpointRow checkpoint);

    @Update("UPDATE chain_checkpoints SET anchor_seq = #{cp.anchorSeq}, anchor_hash = #{cp.anchorHash},"
            + " purged_count = #{cp.purgedCount}, purged_at = #{cp.purgedAt}"
            + " WHERE kind = #{cp.kind} AND scope_id = #{cp.scopeId}")
    int updateCheckpoint(@Param("cp") ChainCheckpointRow checkpoint);
}
