package domain.validate;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** 필수 필드 + 별칭. */
public final class RequiredField {

    private final String name;
    private final List<String> aliases;

    public RequiredField(String name, List<String> aliases) {
        this.name = Objects.requireNonNull(name, "name");
        this.aliases = aliases == null ? List.of() : List.copyOf(aliases);
    }

    public static RequiredField of(String name, String... aliases) {
        return new RequiredField(name, List.of(aliases));
    }

    /** 개인이력카드 기준 체크리스트. */
    public static List<RequiredField> defaults() {
        return List.of(
                of("성명", "이름", "성 명", "성  명", "name"),
                of("연락처", "전화번호", "핸드폰", "휴대폰", "휴대전화", "전화", "phone", "tel", "연 락 처"),
                of("생년월일", "생일", "출생일", "생년 월일", "birthday", "birth"),
                of("이메일", "email", "e-mail", "메일", "이 메 일"),
                of("성별", "sex", "gender", "성 별"),
                of("거주지", "주소", "거주주소", "현거주지", "거 주 지", "address"),
                of("참여분야", "분야", "참여 분야"),
                of("수행기관", "기관", "수행 기관", "기관명"),
                of("사업명", "사업", "프로젝트", "사 업 명"),
                of("참여기간", "기간", "참여 기간"),
                of("국가", "국 가", "나라", "country"),
                of("직무", "직 무", "업무", "job", "position"),
                of("희망직종", "희망 직종", "직종"),
                of("희망직무", "희망 직무"),
                of("1분기", "1 분기"),
                of("2분기", "2 분기"),
                of("3분기", "3 분기"),
                of("4분기", "4 분기")
        );
    }

    public String getName() {
        return name;
    }

    public List<String> getAliases() {
        return aliases;
    }

    /** name 을 맨 앞에 둔 전체 이름 목록. */
    public List<String> allNames() {
        List<String> all = new ArrayList<>(aliases.size() + 1);
        all.add(name);
        all.addAll(aliases);
        return all;
    }
}
