package com.ewale.ewale.service.ussd.handler;

import com.ewale.ewale.dto.ServiceQueryItem;
import com.ewale.ewale.dto.ServiceQueryResponse;
import com.ewale.ewale.dto.UssdRequest;
import com.ewale.ewale.dto.UssdResponse;
import com.ewale.ewale.entity.NetworkProvider;
import com.ewale.ewale.entity.UssdServiceType;
import com.ewale.ewale.exception.HubtelApiException;
import com.ewale.ewale.service.HubtelCatalogService;
import com.ewale.ewale.service.PaymentRequestService;
import com.ewale.ewale.service.ussd.BundleGroup;
import com.ewale.ewale.service.ussd.SessionState;
import com.ewale.ewale.service.ussd.UssdResponseBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("BundleHandler Unit Tests")
class BundleHandlerTest {

    private static final String SESSION_ID = "S1";
    private static final String MOBILE = "233550982043";

    @Mock
    private HubtelCatalogService catalogService;

    @Mock
    private PaymentRequestService paymentRequestService;

    private BundleHandler bundleHandler;
    private SessionState state;

    @BeforeEach
    void setUp() {
        bundleHandler = new BundleHandler(new UssdResponseBuilder(), paymentRequestService, catalogService);
        state = new SessionState(SESSION_ID);
        state.setServiceType(UssdServiceType.DATA_BUNDLE);
        state.setNetwork(NetworkProvider.MTN);
    }

    private static UssdRequest input(String message) {
        UssdRequest request = new UssdRequest();
        request.setSessionId(SESSION_ID);
        request.setMobile(MOBILE);
        request.setMessage(message);
        return request;
    }

    private static List<ServiceQueryItem> dataBundles(int count) {
        List<ServiceQueryItem> bundles = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            bundles.add(new ServiceQueryItem(i + "GB Data", "DATA" + i, BigDecimal.valueOf(i * 5L)));
        }
        return bundles;
    }

    private void loadGroup(int bundleCount) {
        state.setBundleGroups(new ArrayList<>(List.of(new BundleGroup("Data Bundles", dataBundles(bundleCount)))));
        state.setCurrentGroupIndex(0);
        state.setCurrentBundlePage(0);
    }

    @Test
    @DisplayName("Buying for self loads bundles and shows packages")
    void selfLoadsPackages() {
        // Given
        List<ServiceQueryItem> catalog = new ArrayList<>(dataBundles(2));
        catalog.add(new ServiceQueryItem("Kokrokoo 400MB", "KOKROKOO400", new BigDecimal("3")));
        when(catalogService.queryBundles(NetworkProvider.MTN, MOBILE))
                .thenReturn(new ServiceQueryResponse("0000", "Success", null, catalog));

        // When
        UssdResponse response = bundleHandler.selectBuyerFlow(input("1"), state);

        // Then
        assertThat(response.getLabel()).isEqualTo("Bundle Packages");
        assertThat(response.getMessage()).contains("1. Data Bundles", "2. Kokrokoo Bundles");
        assertThat(state.isCategorySelectionMode()).isTrue();
        assertThat(state.getBundleGroups()).hasSize(2);
    }

    @Test
    @DisplayName("Empty catalogue releases with an error")
    void emptyCatalogue() {
        when(catalogService.queryBundles(NetworkProvider.MTN, MOBILE))
                .thenReturn(new ServiceQueryResponse("0000", "Success", null, new ArrayList<>()));

        UssdResponse response = bundleHandler.selectBuyerFlow(input("1"), state);

        assertThat(response.isRelease()).isTrue();
        assertThat(response.getMessage()).isEqualTo("No bundles available for this network. Please try another network.");
    }

    @Test
    @DisplayName("Catalogue failure releases with an error")
    void catalogueFailure() {
        when(catalogService.queryBundles(NetworkProvider.MTN, MOBILE))
                .thenThrow(new HubtelApiException("timeout"));

        UssdResponse response = bundleHandler.selectBuyerFlow(input("1"), state);

        assertThat(response.isRelease()).isTrue();
        assertThat(response.getMessage()).isEqualTo("Unable to fetch bundles. Please try again.");
    }

    @Test
    @DisplayName("First page shows four bundles with next and back-to-packages")
    void firstPage() {
        // Given
        loadGroup(6);
        state.setCategorySelectionMode(true);

        // When
        UssdResponse response = bundleHandler.selectCategory(input("1"), state);

        // Then
        assertThat(response.getLabel()).isEqualTo("Page 1 of 2");
        assertThat(response.getMessage())
                .contains("1. 1GB Data - GH5", "4. 4GB Data - GH20", "0. Next", "99. Back to Packages")
                .doesNotContain("5GB Data", "00. Back");
        assertThat(state.isCategorySelectionMode()).isFalse();
    }

    @Test
    @DisplayName("Next then back moves between pages")
    void nextAndPrevious() {
        // Given
        loadGroup(6);

        // When
        UssdResponse next = bundleHandler.selectBundle(input("0"), state);

        // Then
        assertThat(next.getLabel()).isEqualTo("Page 2 of 2");
        assertThat(next.getMessage()).contains("1. 5GB Data", "2. 6GB Data", "00. Back").doesNotContain("0. Next");

        UssdResponse back = bundleHandler.selectBundle(input("00"), state);
        assertThat(back.getLabel()).isEqualTo("Page 1 of 2");
        assertThat(state.getCurrentBundlePage()).isZero();
    }

    @Test
    @DisplayName("Next on the last page and back on the first page release with an error")
    void pagingBounds() {
        loadGroup(3);

        assertThat(bundleHandler.selectBundle(input("0"), state).getMessage()).isEqualTo("No more bundles to show");
        assertThat(bundleHandler.selectBundle(input("00"), state).getMessage()).isEqualTo("Already on first page");
    }

    @Test
    @DisplayName("99 returns to the package list")
    void backToPackages() {
        // Given
        loadGroup(6);
        state.setCurrentBundlePage(1);

        // When
        UssdResponse response = bundleHandler.selectBundle(input("99"), state);

        // Then
        assertThat(response.getLabel()).isEqualTo("Bundle Packages");
        assertThat(state.isCategorySelectionMode()).isTrue();
        assertThat(state.getCurrentBundlePage()).isZero();
    }

    @Test
    @DisplayName("Picking a bundle on page two records it and shows the summary")
    void selectOnSecondPage() {
        // Given
        loadGroup(6);
        state.setMobile(MOBILE);
        state.setCurrentBundlePage(1);

        // When
        UssdResponse response = bundleHandler.selectBundle(input("2"), state);

        // Then
        assertThat(state.getSelectedBundle().getValue()).isEqualTo("DATA6");
        assertThat(state.getBundleValue()).isEqualTo("DATA6");
        assertThat(state.getTotalAmount()).isEqualByComparingTo("30");
        assertThat(response.getLabel()).isEqualTo("Order Summary");
        assertThat(response.getMessage()).contains("Bundle: 6GB Data", "Amount: GH30.00", "1. Confirm");
    }

    @Test
    @DisplayName("Choice beyond the page releases with an error")
    void invalidChoice() {
        loadGroup(6);
        state.setCurrentBundlePage(1);

        UssdResponse response = bundleHandler.selectBundle(input("3"), state);

        assertThat(response.getMessage()).isEqualTo("Please select a valid bundle option");
        assertThat(state.getSelectedBundle()).isNull();
    }

    @Test
    @DisplayName("Bundles are grouped by keyword and each group is capped")
    void grouping() {
        // Given
        List<ServiceQueryItem> bundles = new ArrayList<>(dataBundles(10));
        bundles.add(new ServiceQueryItem("Night 12AM-5AM", "BNIGHT1", BigDecimal.ONE));
        bundles.add(new ServiceQueryItem("YouTube Video 1GB", "VIDEO1", BigDecimal.TEN));

        // When
        List<BundleGroup> groups = BundleHandler.groupByCategory(bundles);

        // Then
        assertThat(groups).extracting(BundleGroup::getName)
                .containsExactly("Data Bundles", "Night Bundles", "Video Bundles");
        assertThat(groups.get(0).getBundles()).hasSize(BundleHandler.BUNDLES_PER_GROUP);
    }
}
