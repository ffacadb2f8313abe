package com.cementtracker.delivery.db.mybatis;

import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.util.List;

/**
 * SQL for the {@code delivery_reports} table. Dates are bound as ISO {@code yyyy-MM-dd} strings.
 */
public interface DeliveryReportMapper {
    String COLUMNS = "date, short AS short_kg, excess AS excess_kg, per_bag_short_excess, bag_weight, " +
            "email_subject, email_received";

    @Select("SELECT " + COLUMNS + " FROM delivery_reports ORDER BY date")
    List<DeliveryReportRow> selectAll();

    @Select("SELECT " + COLUMNS + " FROM delivery_reports WHERE date >= #{from} AND date <= #{to} ORDER BY date")
    List<DeliveryReportRow> selectRange(@Param("from") String from, @Param("to") String to);

    @Select("SELECT " + COLUMNS + " FROM delivery_reports WHERE date = #{date}")
    DeliveryReportRow selectByDate(@Param("date") String date);

    /**
     * Insert or replace by date; the newest write for a date always wins.
     */
    @Insert("INSERT INTO delivery_reports(date, short, excess, per_bag_short_excess, bag_weight, email_subject, email_received) " +
            "VALUES(#{date}, #{shortKg}, #{excessKg}, #{perBagShortExcess}, #{bagWeight}, #{emailSubject}, #{emailReceived}) " +
            "ON CONFLICT(date) DO UPDATE SET short=excluded.short, excess=excluded.excess, " +
            "per_bag_short_excess=excluded.per_bag_short_excess, bag_weight=excluded.bag_weight, " +
            "email_subject=excluded.email_subject, email_received=excluded.email_received")
    int upsertReport(DeliveryReportRow row);

    @Delete("DELETE FROM delivery_reports WHERE date = #{date}")
    int deleteByDate(@Param("date") String date);

    @Update("ALTER TABLE delivery_reports ADD COLUMN bag_weight DOUBLE PRECISION")
    void addBagWeightColumn();

    // Backfill source for the bag_weight column migration.
    @Select("SELECT date, per_bag_short_excess FROM delivery_reports WHERE per_bag_short_excess IS NOT NULL")
    List<DeliveryReportRow> selectPerBagValues();

    @Update("UPDATE delivery_reports SET bag_weight = #{bagWeight} WHERE date = #{date}")
    int updateBagWeight(@Param("date") String date, @Param("bagWeight") double bagWeight);
}
