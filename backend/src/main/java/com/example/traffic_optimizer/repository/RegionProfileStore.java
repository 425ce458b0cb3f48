package com.example.traffic_optimizer.repository;

import com.example.traffic_optimizer.entity.BusRoute;
import com.example.traffic_optimizer.entity.CityTrafficProfile;
import com.example.traffic_optimizer.entity.ConstructionZone;
import com.example.traffic_optimizer.entity.DevelopmentZone;
import com.example.traffic_optimizer.entity.FestivalPattern;
import com.example.traffic_optimizer.entity.HistoricalTrafficRecord;
import com.example.traffic_optimizer.entity.InfrastructureUpdate;
import com.example.traffic_optimizer.entity.RegionDataSet;
import com.example.traffic_optimizer.entity.WeatherImpact;
import com.example.traffic_optimizer.entity.enumclass.BusRouteType;
import com.example.traffic_optimizer.exception.RegionDataException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * 지역 교통 기준 데이터의 읽기 전용 스냅샷.
 * 생성 시점에 검증되며 이후 변경되지 않는다. 도시 이름 조회는 대소문자를 구분하지 않는다.
 */
public final class RegionProfileStore {

    private final String version;
    private final Map<String, CityTrafficProfile> citiesByName;
    private final List<FestivalPattern> festivals;
    private final List<ConstructionZone> constructionZones;
    private final List<InfrastructureUpdate> infrastructureUpdates;
    private final List<BusRoute> busRoutes;
    private final List<DevelopmentZone> developmentZones;
    private final List<HistoricalTrafficRecord> historicalData;
    private final List<WeatherImpact> weatherImpacts;

    private RegionProfileStore(RegionDataSet dataSet) {
        this.version = dataSet.getVersion() != null ? dataSet.getVersion() : "unversioned";

        Map<String, CityTrafficProfile> cities = new LinkedHashMap<>();
        for (CityTrafficProfile city : nullToEmpty(dataSet.getCities())) {
            validateCity(city);
            if (cities.putIfAbsent(normalize(city.getName()), freeze(city)) != null) {
                throw new RegionDataException("Duplicate city profile. city=" + city.getName());
            }
        }
        this.citiesByName = Collections.unmodifiableMap(cities);

        nullToEmpty(dataSet.getFestivals()).forEach(RegionProfileStore::validateFestival);
        nullToEmpty(dataSet.getConstructionZones()).forEach(RegionProfileStore::validateConstructionZone);

        this.festivals = freezeAll(dataSet.getFestivals(), RegionProfileStore::freeze);
        this.constructionZones = freezeAll(dataSet.getConstructionZones(), RegionProfileStore::freeze);
        this.infrastructureUpdates = freezeAll(dataSet.getInfrastructureUpdates(), RegionProfileStore::freeze);
        this.busRoutes = freezeAll(dataSet.getBusRoutes(), RegionProfileStore::freeze);
        this.developmentZones = freezeAll(dataSet.getDevelopmentZones(), RegionProfileStore::freeze);
        this.historicalData = freezeAll(dataSet.getHistoricalData(), RegionProfileStore::freeze);
        this.weatherImpacts = freezeAll(dataSet.getWeatherImpacts(), RegionProfileStore::freeze);
    }

    public static RegionProfileStore of(RegionDataSet dataSet) {
        if (dataSet == null) {
            throw new RegionDataException("Region data set is empty");
        }
        return new RegionProfileStore(dataSet);
    }

    public static RegionProfileStore empty() {
        return of(RegionDataSet.builder().version("empty").build());
    }

    public String getVersion() {
        return version;
    }

    public Optional<CityTrafficProfile> getCityProfile(String cityName) {
        if (cityName == null || cityName.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(citiesByName.get(normalize(cityName)));
    }

    public List<CityTrafficProfile> getCities() {
        return List.copyOf(citiesByName.values());
    }

    /**
     *  진행 중(ACTIVE/DELAYED) 공사 구간. 도시가 없으면 전체
     */
    public List<ConstructionZone> getActiveConstructionZones(String cityName) {
        return constructionZones.stream()
                .filter(ConstructionZone::isLive)
                .filter(zone -> cityName == null || matches(zone.getCity(), cityName))
                .toList();
    }

    /**
     *  이번 달 또는 다음 달 축제 (한 달 앞서 미리 노출)
     */
    public List<FestivalPattern> getUpcomingFestivals(int month) {
        return festivals.stream()
                .filter(festival -> festival.isUpcoming(month))
                .toList();
    }

    public List<InfrastructureUpdate> getInfrastructureUpdates(String cityName, Integer afterYear) {
        return infrastructureUpdates.stream()
                .filter(update -> matches(update.getCity(), cityName))
                .filter(update -> afterYear == null
                        || (update.getCompletionDate() != null && update.getCompletionDate().getYear() >= afterYear))
                .toList();
    }

    public List<BusRoute> getBusRoutes(String cityName, BusRouteType type) {
        return busRoutes.stream()
                .filter(route -> matches(route.getCity(), cityName))
                .filter(route -> type == null || route.getType() == type)
                .toList();
    }

    public List<DevelopmentZone> getDevelopmentZones(String cityName) {
        return developmentZones.stream()
                .filter(zone -> matches(zone.getCity(), cityName))
                .toList();
    }

    public List<HistoricalTrafficRecord> getHistoricalData(String cityName, int startYear, int endYear) {
        return historicalData.stream()
                .filter(record -> matches(record.getCity(), cityName))
                .filter(record -> record.getYear() >= startYear && record.getYear() <= endYear)
                .toList();
    }

    public Optional<WeatherImpact> getWeatherImpact(String condition) {
        if (condition == null || condition.isBlank()) {
            return Optional.empty();
        }
        String needle = normalize(condition);
        return weatherImpacts.stream()
                .filter(impact -> normalize(impact.getCondition()).contains(needle))
                .findFirst();
    }

    public List<FestivalPattern> getFestivals() {
        return festivals;
    }

    public List<ConstructionZone> getConstructionZones() {
        return constructionZones;
    }

    public List<InfrastructureUpdate> getInfrastructureUpdates() {
        return infrastructureUpdates;
    }

    public List<BusRoute> getBusRoutes() {
        return busRoutes;
    }

    public List<DevelopmentZone> getDevelopmentZones() {
        return developmentZones;
    }

    public List<HistoricalTrafficRecord> getHistoricalData() {
        return historicalData;
    }

    public List<WeatherImpact> getWeatherImpacts() {
        return weatherImpacts;
    }

    // ========================================
    //  Validation
    // ========================================

    private static void validateCity(CityTrafficProfile city) {
        if (city == null || city.getName() == null || city.getName().isBlank()) {
            throw new RegionDataException("City profile without a name");
        }
        if (city.getPeakHours() == null || city.getPeakHours().getMorning() == null
                || city.getPeakHours().getEvening() == null) {
            throw new RegionDataException("Missing peak hours. city=" + city.getName());
        }
        validatePeakWindow(city.getName(), city.getPeakHours().getMorning());
        validatePeakWindow(city.getName(), city.getPeakHours().getEvening());

        CityTrafficProfile.AverageSpeed speed = city.getAverageSpeed();
        if (speed == null) {
            throw new RegionDataException("Missing average speeds. city=" + city.getName());
        }
        if (!(speed.getPeak() > 0 && speed.getPeak() < speed.getOffPeak() && speed.getOffPeak() < speed.getNight())) {
            throw new RegionDataException("Average speeds must satisfy 0 < peak < offPeak < night. city="
                    + city.getName());
        }
    }

    private static void validatePeakWindow(String cityName, CityTrafficProfile.PeakWindow window) {
        if (window.getStart() < 0 || window.getEnd() > 23 || window.getStart() > window.getEnd()) {
            throw new RegionDataException("Invalid peak window " + window.getStart() + "-" + window.getEnd()
                    + ". city=" + cityName);
        }
        if (window.getSeverity() < 1 || window.getSeverity() > 10) {
            throw new RegionDataException("Peak severity must be within 1-10. city=" + cityName);
        }
    }

    private static void validateFestival(FestivalPattern festival) {
        if (festival.getTrafficMultiplier() < 1) {
            throw new RegionDataException("Festival multiplier must be >= 1. festival=" + festival.getName());
        }
        for (Integer month : nullToEmpty(festival.getMonths())) {
            if (month == null || month < 1 || month > 12) {
                throw new RegionDataException("Festival month out of range. festival=" + festival.getName());
            }
        }
    }

    private static void validateConstructionZone(ConstructionZone zone) {
        if (zone.getDelayMinutes() < 0) {
            throw new RegionDataException("Construction delay must be >= 0. zone=" + zone.getId());
        }
        if (zone.getStatus() == null) {
            throw new RegionDataException("Construction zone without status. zone=" + zone.getId());
        }
    }

    // ========================================
    //  Snapshot copies (내부 리스트까지 읽기 전용)
    // ========================================

    private static CityTrafficProfile freeze(CityTrafficProfile city) {
        return city.toBuilder()
                .trafficHotspots(readOnly(city.getTrafficHotspots()))
                .majorRoads(readOnly(city.getMajorRoads()))
                .build();
    }

    private static FestivalPattern freeze(FestivalPattern festival) {
        return festival.toBuilder()
                .regions(readOnly(festival.getRegions()))
                .months(readOnly(festival.getMonths()))
                .affectedRoutes(readOnly(festival.getAffectedRoutes()))
                .recommendations(readOnly(festival.getRecommendations()))
                .build();
    }

    private static ConstructionZone freeze(ConstructionZone zone) {
        return zone.toBuilder()
                .alternateRoutes(readOnly(zone.getAlternateRoutes()))
                .affectedDirections(readOnly(zone.getAffectedDirections()))
                .build();
    }

    private static InfrastructureUpdate freeze(InfrastructureUpdate update) {
        return update.toBuilder()
                .impactAreas(readOnly(update.getImpactAreas()))
                .build();
    }

    private static BusRoute freeze(BusRoute route) {
        return route.toBuilder()
                .majorStops(readOnly(route.getMajorStops()))
                .build();
    }

    private static DevelopmentZone freeze(DevelopmentZone zone) {
        return zone.toBuilder()
                .peakTrafficTimes(readOnly(zone.getPeakTrafficTimes()))
                .nearbyLandmarks(readOnly(zone.getNearbyLandmarks()))
                .trafficChallenges(readOnly(zone.getTrafficChallenges()))
                .build();
    }

    private static HistoricalTrafficRecord freeze(HistoricalTrafficRecord record) {
        return record.toBuilder()
                .majorEvents(readOnly(record.getMajorEvents()))
                .build();
    }

    private static WeatherImpact freeze(WeatherImpact impact) {
        return impact.toBuilder()
                .recommendations(readOnly(impact.getRecommendations()))
                .build();
    }

    private static <T> List<T> freezeAll(List<T> items, UnaryOperator<T> freezer) {
        return nullToEmpty(items).stream()
                .map(freezer)
                .toList();
    }

    // null 원소 허용
    private static <T> List<T> readOnly(List<T> list) {
        return list != null ? Collections.unmodifiableList(new ArrayList<>(list)) : null;
    }

    private static boolean matches(String value, String cityName) {
        return value != null && cityName != null && normalize(value).equals(normalize(cityName));
    }

    private static String normalize(String value) {
        return value.trim().toLowerCase(Locale.ROOT);
    }

    private static <T> List<T> nullToEmpty(List<T> list) {
        return list != null ? new ArrayList<>(list) : new ArrayList<>();
    }
}
